package com.leadtracker.leadtracker.store;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import com.leadtracker.leadtracker.ingest.IngestProperties;
import com.leadtracker.leadtracker.ingest.PropertyStatus;
import com.leadtracker.leadtracker.ingest.ValueCoercion;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot lifecycle rows and the canonical records of each snapshot.
 */
@Repository
public class SnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRepository.class);

    private static final String PROPERTY_COLUMNS = "snapshot_id, account_number, owner_name, property_address, "
            + "mailing_address, status, total_due, percentage_due, legal_description, tax_year, market_value, "
            + "land_value, improvement_value, capped_value, agricultural_value, exemptions, jurisdictions, "
            + "last_payment_date, last_payment_amount, last_payer, delinquent_after, half_payment_option_amount, "
            + "prior_years_amount_due, year_amount_due, year_tax_levy, link, owner_address, source_row_index";
    private static final int PROPERTY_COLUMN_COUNT = 28;
    private static final String LIST_DELIMITER = ", ";
    private static final int CREATE_ATTEMPTS = 5;

    private static final RowMapper<Snapshot> SNAPSHOT_MAPPER = (rs, rowNum) -> new Snapshot(
            rs.getLong("snapshot_id"),
            rs.getString("file_name"),
            Instant.ofEpochMilli(rs.getLong("created_at")),
            SnapshotStatus.valueOf(rs.getString("status")),
            rs.getInt("property_count"),
            rs.getInt("rows_read"),
            rs.getInt("rows_dropped"),
            rs.getString("error_message")
    );

    private final JdbcTemplate jdbcTemplate;
    private final IngestProperties ingestProperties;

    public SnapshotRepository(JdbcTemplate jdbcTemplate, IngestProperties ingestProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.ingestProperties = ingestProperties;
    }

    /**
     * Creates snapshot tables at startup so they exist before the first ingestion.
     */
    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + IngestConstants.SNAPSHOT_TABLE + " ("
                + "snapshot_id BIGINT PRIMARY KEY, "
                + "file_name VARCHAR(512) NOT NULL, "
                + "created_at BIGINT NOT NULL, "
                + "status VARCHAR(16) NOT NULL, "
                + "property_count INT NOT NULL, "
                + "rows_read INT NOT NULL, "
                + "rows_dropped INT NOT NULL, "
                + "error_message TEXT"
                + ")");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + IngestConstants.SNAPSHOT_PROPERTY_TABLE + " ("
                + "snapshot_id BIGINT NOT NULL, "
                + "account_number VARCHAR NOT NULL, "
                + "owner_name TEXT, "
                + "property_address TEXT, "
                + "mailing_address TEXT, "
                + "status VARCHAR(16) NOT NULL, "
                + "total_due DOUBLE PRECISION NOT NULL, "
                + "percentage_due DOUBLE PRECISION NOT NULL, "
                + "legal_description TEXT, "
                + "tax_year INT, "
                + "market_value DOUBLE PRECISION, "
                + "land_value DOUBLE PRECISION, "
                + "improvement_value DOUBLE PRECISION, "
                + "capped_value DOUBLE PRECISION, "
                + "agricultural_value DOUBLE PRECISION, "
                + "exemptions TEXT, "
                + "jurisdictions TEXT, "
                + "last_payment_date DATE, "
                + "last_payment_amount DOUBLE PRECISION, "
                + "last_payer TEXT, "
                + "delinquent_after DATE, "
                + "half_payment_option_amount DOUBLE PRECISION, "
                + "prior_years_amount_due DOUBLE PRECISION, "
                + "year_amount_due DOUBLE PRECISION, "
                + "year_tax_levy DOUBLE PRECISION, "
                + "link TEXT, "
                + "owner_address TEXT, "
                + "source_row_index INT NOT NULL"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_snapshot_property_snapshot ON "
                + IngestConstants.SNAPSHOT_PROPERTY_TABLE + " (snapshot_id, account_number)");
    }

    /**
     * Inserts a PROCESSING snapshot row and returns its id. An id taken by a concurrent ingestion
     * between generation and insert is regenerated.
     */
    public long createSnapshot(String fileName) {
        for (int attempt = 0; attempt < CREATE_ATTEMPTS; attempt++) {
            long snapshotId = generateSnapshotId();
            try {
                jdbcTemplate.update("INSERT INTO " + IngestConstants.SNAPSHOT_TABLE
                                + " (snapshot_id, file_name, created_at, status, property_count, rows_read, rows_dropped) "
                                + "VALUES (?, ?, ?, ?, 0, 0, 0)",
                        snapshotId, fileName, Instant.now().toEpochMilli(), SnapshotStatus.PROCESSING.name());
                return snapshotId;
            } catch (DuplicateKeyException ex) {
                log.debug("Snapshot id {} taken concurrently; retrying", snapshotId);
            }
        }
        throw new IllegalStateException(IngestConstants.MSG_SNAPSHOT_ID_NOT_GENERATED);
    }

    public void saveProperties(long snapshotId, List<CanonicalProperty> properties) {
        String placeholders = String.join(", ", Collections.nCopies(PROPERTY_COLUMN_COUNT, "?"));
        String sql = "INSERT INTO " + IngestConstants.SNAPSHOT_PROPERTY_TABLE
                + " (" + PROPERTY_COLUMNS + ") VALUES (" + placeholders + ")";
        int batchSize = Math.max(1, ingestProperties.getInsertBatchSize());
        jdbcTemplate.batchUpdate(sql, properties, batchSize, (ps, property) -> bindProperty(ps, snapshotId, property));
    }

    public void markCompleted(long snapshotId, int propertyCount, int rowsRead, int rowsDropped) {
        jdbcTemplate.update("UPDATE " + IngestConstants.SNAPSHOT_TABLE
                        + " SET status = ?, property_count = ?, rows_read = ?, rows_dropped = ?, error_message = NULL"
                        + " WHERE snapshot_id = ?",
                SnapshotStatus.COMPLETED.name(), propertyCount, rowsRead, rowsDropped, snapshotId);
    }

    /**
     * Records a failed ingestion. Records saved before the failure are removed.
     */
    public void markError(long snapshotId, String errorMessage) {
        jdbcTemplate.update("DELETE FROM " + IngestConstants.SNAPSHOT_PROPERTY_TABLE + " WHERE snapshot_id = ?",
                snapshotId);
        jdbcTemplate.update("UPDATE " + IngestConstants.SNAPSHOT_TABLE
                        + " SET status = ?, property_count = 0, error_message = ? WHERE snapshot_id = ?",
                SnapshotStatus.ERROR.name(), errorMessage, snapshotId);
    }

    public Optional<Snapshot> findById(long snapshotId) {
        List<Snapshot> rows = jdbcTemplate.query(
                "SELECT * FROM " + IngestConstants.SNAPSHOT_TABLE + " WHERE snapshot_id = ?",
                SNAPSHOT_MAPPER,
                snapshotId
        );
        return rows.stream().findFirst();
    }

    /**
     * Most recent completed snapshot with an id lower than the given one.
     */
    public Optional<Snapshot> findLatestCompletedBefore(long snapshotId) {
        List<Snapshot> rows = jdbcTemplate.query(
                "SELECT * FROM " + IngestConstants.SNAPSHOT_TABLE
                        + " WHERE status = ? AND snapshot_id < ? ORDER BY snapshot_id DESC LIMIT 1",
                SNAPSHOT_MAPPER,
                SnapshotStatus.COMPLETED.name(),
                snapshotId
        );
        return rows.stream().findFirst();
    }

    public List<Snapshot> findLatestCompleted(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM " + IngestConstants.SNAPSHOT_TABLE
                        + " WHERE status = ? ORDER BY snapshot_id DESC LIMIT ?",
                SNAPSHOT_MAPPER,
                SnapshotStatus.COMPLETED.name(),
                limit
        );
    }

    public List<Snapshot> listSnapshots() {
        return jdbcTemplate.query(
                "SELECT * FROM " + IngestConstants.SNAPSHOT_TABLE + " ORDER BY snapshot_id DESC",
                SNAPSHOT_MAPPER
        );
    }

    public boolean hasCompletedSnapshotForFile(String fileName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + IngestConstants.SNAPSHOT_TABLE + " WHERE file_name = ? AND status = ?",
                Integer.class,
                fileName,
                SnapshotStatus.COMPLETED.name()
        );
        return count != null && count > 0;
    }

    /**
     * Loads a snapshot's records ordered by account number, then source row.
     */
    public List<CanonicalProperty> loadProperties(long snapshotId) {
        return jdbcTemplate.query(
                "SELECT " + PROPERTY_COLUMNS + " FROM " + IngestConstants.SNAPSHOT_PROPERTY_TABLE
                        + " WHERE snapshot_id = ? ORDER BY account_number, source_row_index",
                (rs, rowNum) -> mapProperty(rs),
                snapshotId
        );
    }

    private void bindProperty(PreparedStatement ps, long snapshotId, CanonicalProperty property) throws SQLException {
        int i = 1;
        ps.setLong(i++, snapshotId);
        ps.setString(i++, property.accountNumber());
        ps.setString(i++, property.ownerName());
        ps.setString(i++, property.propertyAddress());
        ps.setString(i++, property.mailingAddress());
        ps.setString(i++, property.status().name());
        ps.setDouble(i++, property.totalDue());
        ps.setDouble(i++, property.percentageDue());
        ps.setString(i++, property.legalDescription());
        setInteger(ps, i++, property.taxYear());
        setDouble(ps, i++, property.marketValue());
        setDouble(ps, i++, property.landValue());
        setDouble(ps, i++, property.improvementValue());
        setDouble(ps, i++, property.cappedValue());
        setDouble(ps, i++, property.agriculturalValue());
        ps.setString(i++, String.join(LIST_DELIMITER, property.exemptions()));
        ps.setString(i++, String.join(LIST_DELIMITER, property.jurisdictions()));
        setDate(ps, i++, property.lastPaymentDate());
        setDouble(ps, i++, property.lastPaymentAmount());
        ps.setString(i++, property.lastPayer());
        setDate(ps, i++, property.delinquentAfter());
        setDouble(ps, i++, property.halfPaymentOptionAmount());
        setDouble(ps, i++, property.priorYearsAmountDue());
        setDouble(ps, i++, property.yearAmountDue());
        setDouble(ps, i++, property.yearTaxLevy());
        ps.setString(i++, property.link());
        ps.setString(i++, property.ownerAddress());
        ps.setInt(i, property.sourceRowIndex());
    }

    private CanonicalProperty mapProperty(ResultSet rs) throws SQLException {
        return CanonicalProperty.builder(rs.getString("account_number"))
                .ownerName(rs.getString("owner_name"))
                .propertyAddress(rs.getString("property_address"))
                .mailingAddress(rs.getString("mailing_address"))
                .status(PropertyStatus.fromStored(rs.getString("status")))
                .totalDue(rs.getDouble("total_due"))
                .percentageDue(rs.getDouble("percentage_due"))
                .legalDescription(rs.getString("legal_description"))
                .taxYear(rs.getObject("tax_year", Integer.class))
                .marketValue(rs.getObject("market_value", Double.class))
                .landValue(rs.getObject("land_value", Double.class))
                .improvementValue(rs.getObject("improvement_value", Double.class))
                .cappedValue(rs.getObject("capped_value", Double.class))
                .agriculturalValue(rs.getObject("agricultural_value", Double.class))
                .exemptions(ValueCoercion.splitList(rs.getString("exemptions")))
                .jurisdictions(ValueCoercion.splitList(rs.getString("jurisdictions")))
                .lastPaymentDate(rs.getObject("last_payment_date", LocalDate.class))
                .lastPaymentAmount(rs.getObject("last_payment_amount", Double.class))
                .lastPayer(rs.getString("last_payer"))
                .delinquentAfter(rs.getObject("delinquent_after", LocalDate.class))
                .halfPaymentOptionAmount(rs.getObject("half_payment_option_amount", Double.class))
                .priorYearsAmountDue(rs.getObject("prior_years_amount_due", Double.class))
                .yearAmountDue(rs.getObject("year_amount_due", Double.class))
                .yearTaxLevy(rs.getObject("year_tax_levy", Double.class))
                .link(rs.getString("link"))
                .ownerAddress(rs.getString("owner_address"))
                .sourceRowIndex(rs.getInt("source_row_index"))
                .build();
    }

    private void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    private void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private void setDate(PreparedStatement ps, int index, LocalDate value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DATE);
        } else {
            ps.setObject(index, value);
        }
    }

    long generateSnapshotId() {
        long candidate = Instant.now().toEpochMilli();
        Long latest = jdbcTemplate.queryForObject(
                "SELECT MAX(snapshot_id) FROM " + IngestConstants.SNAPSHOT_TABLE,
                Long.class
        );
        if (latest != null && candidate <= latest) {
            candidate = latest + 1;
        }
        for (int attempt = 0; attempt < 1000; attempt++) {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + IngestConstants.SNAPSHOT_TABLE + " WHERE snapshot_id = ?",
                    Integer.class,
                    candidate
            );
            if (count == null || count == 0) {
                return candidate;
            }
            candidate++;
        }
        throw new IllegalStateException(IngestConstants.MSG_SNAPSHOT_ID_NOT_GENERATED);
    }
}
