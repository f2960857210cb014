package com.iksanov.surveyshield.node.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class DataSourceFactory {
    public static HikariDataSource create(String jdbcUrl, String user, String pass, int maxPool) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(jdbcUrl);
        if (user != null) cfg.setUsername(user);
        if (pass != null) cfg.setPassword(pass);
        cfg.setMaximumPoolSize(maxPool);
        cfg.setPoolName("survey-shield-ds");
        cfg.setConnectionTimeout(5_000);
        cfg.addDataSourceProperty("cachePrepStmts", "true");
        return new HikariDataSource(cfg);
    }
}
