package com.my.dispatch.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 일정 저장소와 중복 명령 로그가 같은 SQLite 파일을 공유하도록 데이터소스를 한 곳에서 만든다.
 */
@ApplicationScoped
public class PersistenceConfig {

    @Produces
    @ApplicationScoped
    public DataSource dataSource(AppConfig appConfig) {
        Path sqlitePath = Path.of(appConfig.store().sqlitePath());
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패: " + sqlitePath, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(5000);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + sqlitePath);
        return dataSource;
    }
}
