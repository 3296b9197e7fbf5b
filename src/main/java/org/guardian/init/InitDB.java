package org.guardian.init;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.guardian.global.GuardianUtils;
import org.guardian.user.UserService;
import org.guardian.user.WhitelistProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SuppressWarnings("java:S6813") // use autowired instead of constructor
public class InitDB {

	@Autowired private R2dbcEntityTemplate db;
	@Autowired private UserService userService;
	@Autowired private WhitelistProperties whitelist;

	// order matters: foreign keys
	private static final String[] TABLES = {
		"users", "auth_tokens"
	};

	public void init() {
		for (var table : TABLES) createTable(table);
		for (var email : whitelist.getInitialUsers()) {
			if (email == null || email.isBlank()) continue;
			userService.resolveOrCreate(email)
			.doOnNext(user -> log.info("Initial user ready: {}", GuardianUtils.maskEmail(user.getEmail())))
			.block();
		}
	}

	@SuppressWarnings("java:S112") // RuntimeException
	private void createTable(String tableName) {
		log.info("Create table {}", tableName);
		String sql;
		try (InputStream in = InitDB.class.getClassLoader().getResourceAsStream("db_init/" + tableName + ".sql")) {
			if (in == null) throw new RuntimeException("Missing schema file for table " + tableName);
			sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new RuntimeException("Unable to read schema file for table " + tableName, e);
		}
		for (String statement : sql.split(";")) {
			if (statement.isBlank()) continue;
			try {
				db.getDatabaseClient().sql(statement.trim()).then().block();
			} catch (Exception e) {
				log.error("Error creating table {}", tableName, e);
				throw new RuntimeException("Database initialization error on table " + tableName, e);
			}
		}
	}

}
