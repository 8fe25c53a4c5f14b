package com.leadtracker.leadtracker.store;

import com.leadtracker.leadtracker.diff.ForeclosureSignal;
import com.leadtracker.leadtracker.diff.ForeclosureSignalSource;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads foreclosure and sale records written by the external court-record scraper.
 */
@Component
public class JdbcForeclosureSignalSource implements ForeclosureSignalSource {

    private final JdbcTemplate jdbcTemplate;

    public JdbcForeclosureSignalSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + IngestConstants.FORECLOSURE_RECORD_TABLE + " ("
                + "record_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "account_number VARCHAR, "
                + "property_address TEXT, "
                + "document_number TEXT, "
                + "sale_date DATE"
                + ")");
    }

    @Override
    public ForeclosureSignal load() {
        List<String> accountNumbers = new ArrayList<>();
        List<String> addresses = new ArrayList<>();
        jdbcTemplate.query(
                "SELECT account_number, property_address FROM " + IngestConstants.FORECLOSURE_RECORD_TABLE,
                (RowCallbackHandler) rs -> {
                    accountNumbers.add(rs.getString("account_number"));
                    addresses.add(rs.getString("property_address"));
                }
        );
        return ForeclosureSignal.of(accountNumbers, addresses);
    }
}
