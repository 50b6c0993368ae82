package io.github.riemr.mobilepost.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        jdbc.execute("CREATE TABLE IF NOT EXISTS mobile_post (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "mobile_code VARCHAR(32), " +
                "seq INTEGER, " +
                "name_en TEXT, name_tc TEXT, name_sc TEXT, " +
                "district_en TEXT, district_tc TEXT, district_sc TEXT, " +
                "location_en TEXT, location_tc TEXT, location_sc TEXT, " +
                "address_en TEXT, address_tc TEXT, address_sc TEXT, " +
                "open_hour VARCHAR(5), " +
                "close_hour VARCHAR(5), " +
                "day_of_week_code SMALLINT CHECK (day_of_week_code BETWEEN 1 AND 7), " +
                "latitude DOUBLE PRECISION CHECK (latitude BETWEEN -90 AND 90), " +
                "longitude DOUBLE PRECISION CHECK (longitude BETWEEN -180 AND 180), " +
                "imported_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        // (mobile_code, seq) is the natural key whenever both are present
        jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_mobile_post_code_seq ON mobile_post (mobile_code, seq) " +
                "WHERE mobile_code IS NOT NULL AND seq IS NOT NULL");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_mobile_post_day ON mobile_post (day_of_week_code)");
        log.info("mobile_post schema ensured");
    }
}
