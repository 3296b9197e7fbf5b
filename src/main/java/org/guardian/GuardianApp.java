package org.guardian;

import org.guardian.email.EmailService;
import org.guardian.global.GuardianProperties;
import org.guardian.init.InitDB;
import org.guardian.session.SessionService;
import org.guardian.user.WhitelistProperties;
import org.springframework.beans.BeansException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.admin.SpringApplicationAdminJmxAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.freemarker.FreeMarkerAutoConfiguration;
import org.springframework.boot.autoconfigure.jmx.JmxAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.security.oauth2.client.reactive.ReactiveOAuth2ClientAutoConfiguration;
import org.springframework.boot.autoconfigure.security.oauth2.client.reactive.ReactiveOAuth2ClientWebSecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.oauth2.resource.reactive.ReactiveOAuth2ResourceServerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.autoconfigure.thymeleaf.ThymeleafAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.ReactiveMultipartAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.WebSessionIdResolverAutoConfiguration;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

import lombok.extern.slf4j.Slf4j;

@SpringBootApplication(exclude= {
	JmxAutoConfiguration.class,
	ReactiveMultipartAutoConfiguration.class,
	ReactiveOAuth2ResourceServerAutoConfiguration.class,
	ReactiveOAuth2ClientAutoConfiguration.class,
	ReactiveOAuth2ClientWebSecurityAutoConfiguration.class,
	SpringApplicationAdminJmxAutoConfiguration.class,
	SqlInitializationAutoConfiguration.class,
	WebSessionIdResolverAutoConfiguration.class,
	FlywayAutoConfiguration.class,
	FreeMarkerAutoConfiguration.class,
	KafkaAutoConfiguration.class,
	LiquibaseAutoConfiguration.class,
	MongoAutoConfiguration.class,
	MongoReactiveAutoConfiguration.class,
	RabbitAutoConfiguration.class,
	RedisAutoConfiguration.class,
	RedisReactiveAutoConfiguration.class,
	ThymeleafAutoConfiguration.class
})
@EnableScheduling
@ComponentScan
@Slf4j
public class GuardianApp implements SmartLifecycle, ApplicationContextAware {

	public static void main(String[] args) {
		SpringApplication.run(GuardianApp.class, args);
	}

	public void initApp() {
		InitDB init = new InitDB();
		context.getAutowireCapableBeanFactory().autowireBean(init);
		init.init();
		checks(context);
	}

	private void checks(ApplicationContext ctx) {
		log.info(" ✔ Environment: {}", ctx.getBean(GuardianProperties.class).getEnvironment());
		var email = ctx.getBean(EmailService.class);
		if (email.isDelivering()) {
			log.info(" ✔ Email provider: {}", email.getProviderName());
		} else {
			log.warn(" ❌ Email provider is '{}', login codes will not reach users !", email.getProviderName());
		}
		if (ctx.getBean(WhitelistProperties.class).isEnabled()) {
			log.info(" ✔ Whitelist mode enabled, only registered users can request a login code");
		} else {
			log.warn(" ❌ Whitelist mode disabled, any email requesting a code will be registered");
		}
		if (ctx.getBean(SessionService.class).isDefaultSecret()) {
			log.warn(" ❌ JWT secret is the default one, set GUARDIAN_JWT_SECRET before going to production !");
		}
	}

	private boolean running = false;
	private ApplicationContext context;

	@Override
	public void start() {
		initApp();
		running = true;
	}

	@Override
	public void stop() {
		running = false;
	}

	@Override
	public boolean isRunning() {
		return running;
	}

	@Override
	public int getPhase() {
		// before the web server is exposed
		return WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 1025;
	}

	@Override
	public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
		context = applicationContext;
	}
}
