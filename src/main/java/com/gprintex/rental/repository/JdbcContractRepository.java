package com.gprintex.rental.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ContractStatus;
import com.gprintex.rental.domain.ValidationResult;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * JDBC implementation of ContractRepository over the rental_contract table.
 */
@Repository
public class JdbcContractRepository implements ContractRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcContractRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private static final String SELECT_COLUMNS = """
        SELECT id, owner_name, client_name, equipment, start_date, end_date, total_value,
               contract_text, artifact_digest, envelope_id, status, sent_at, completed_at,
               declined_at, created_at, updated_at, version
          FROM rental_contract
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcContractRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Either<List<ValidationResult>, Contract> insert(Contract contract) {
        var validationErrors = validate(contract);
        if (!validationErrors.isEmpty()) {
            return Either.left(validationErrors);
        }

        var sql = """
            INSERT INTO rental_contract (owner_name, client_name, equipment, start_date, end_date,
                total_value, contract_text, status, created_at, updated_at, version)
            VALUES (:owner_name, :client_name, :equipment, :start_date, :end_date,
                :total_value, :contract_text, :status, :created_at, :updated_at, 0)
            """;

        var now = Timestamp.from(clock.instant());
        var params = new MapSqlParameterSource()
            .addValue("owner_name", contract.ownerName())
            .addValue("client_name", contract.clientName())
            .addValue("equipment", writeEquipment(contract.equipmentRefs()), Types.CLOB)
            .addValue("start_date", java.sql.Date.valueOf(contract.startDate()))
            .addValue("end_date", java.sql.Date.valueOf(contract.endDate()))
            .addValue("total_value", contract.totalValue())
            .addValue("contract_text", contract.contractText(), Types.CLOB)
            .addValue("status", contract.status().token())
            .addValue("created_at", now, Types.TIMESTAMP)
            .addValue("updated_at", now, Types.TIMESTAMP);

        try {
            var keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(sql, params, keyHolder, new String[] {"ID"});
            var key = keyHolder.getKey();
            if (key == null) {
                return Either.left(List.of(ValidationResult.error("INSERT_FAILED", "Missing generated id")));
            }
            return findById(key.longValue())
                .map(Either::<List<ValidationResult>, Contract>right)
                .orElseGet(() -> Either.right(contract.withId(key.longValue())));
        } catch (DataAccessException e) {
            log.error("Error inserting contract for owner {} and client {}", contract.ownerName(), contract.clientName(), e);
            return Either.left(List.of(ValidationResult.error("INSERT_FAILED", e.getMessage())));
        }
    }

    @Override
    public Optional<Contract> findById(Long id) {
        var sql = SELECT_COLUMNS + " WHERE id = :id";
        return jdbcTemplate.query(sql, new MapSqlParameterSource("id", id), contractRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public Optional<Contract> findByEnvelopeId(String envelopeId) {
        var sql = SELECT_COLUMNS + " WHERE envelope_id = :envelope_id";
        return jdbcTemplate.query(sql, new MapSqlParameterSource("envelope_id", envelopeId), contractRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public Stream<Contract> findByFilter(ContractFilter filter) {
        var conditions = new ArrayList<String>();
        var params = new MapSqlParameterSource();
        filter.ownerName().ifPresent(owner -> {
            conditions.add("owner_name = :owner_name");
            params.addValue("owner_name", owner);
        });
        filter.clientName().ifPresent(client -> {
            conditions.add("client_name = :client_name");
            params.addValue("client_name", client);
        });

        var sql = new StringBuilder(SELECT_COLUMNS);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY id");

        return jdbcTemplate.queryForStream(sql.toString(), params, contractRowMapper());
    }

    @Override
    public boolean assignEnvelope(Long id, String envelopeId, String artifactDigest) {
        var sql = """
            UPDATE rental_contract
               SET envelope_id = :envelope_id,
                   artifact_digest = :artifact_digest,
                   status = :new_status,
                   updated_at = :updated_at,
                   version = version + 1
             WHERE id = :id
               AND envelope_id IS NULL
               AND status = :expected_status
            """;

        var params = new MapSqlParameterSource()
            .addValue("envelope_id", envelopeId)
            .addValue("artifact_digest", artifactDigest, Types.VARCHAR)
            .addValue("new_status", ContractStatus.SENT_FOR_SIGNING.token())
            .addValue("updated_at", Timestamp.from(clock.instant()), Types.TIMESTAMP)
            .addValue("id", id)
            .addValue("expected_status", ContractStatus.DRAFT.token());

        return jdbcTemplate.update(sql, params) == 1;
    }

    @Override
    public boolean updateSigningState(Contract contract, long expectedVersion) {
        var id = contract.id()
            .orElseThrow(() -> new IllegalArgumentException("Contract id is required for a status update"));

        var sql = """
            UPDATE rental_contract
               SET status = :status,
                   sent_at = :sent_at,
                   completed_at = :completed_at,
                   declined_at = :declined_at,
                   updated_at = :updated_at,
                   version = version + 1
             WHERE id = :id
               AND version = :expected_version
            """;

        var params = new MapSqlParameterSource()
            .addValue("status", contract.status().token())
            .addValue("sent_at", toTimestamp(contract.sentAt()), Types.TIMESTAMP)
            .addValue("completed_at", toTimestamp(contract.completedAt()), Types.TIMESTAMP)
            .addValue("declined_at", toTimestamp(contract.declinedAt()), Types.TIMESTAMP)
            .addValue("updated_at", Timestamp.from(clock.instant()), Types.TIMESTAMP)
            .addValue("id", id)
            .addValue("expected_version", expectedVersion);

        return jdbcTemplate.update(sql, params) == 1;
    }

    List<ValidationResult> validate(Contract contract) {
        var results = new ArrayList<ValidationResult>();
        if (contract.id().isPresent()) {
            results.add(ValidationResult.error("INVALID", "New contracts must not carry an id"));
        }
        if (contract.status() != ContractStatus.DRAFT) {
            results.add(ValidationResult.error("INVALID_STATUS", "Contracts are created as draft"));
        }
        if (contract.envelopeId().isPresent()) {
            results.add(ValidationResult.error("INVALID", "Envelope id is assigned on submission"));
        }
        return results;
    }

    private RowMapper<Contract> contractRowMapper() {
        return (rs, rowNum) -> {
            String status = rs.getString("status");
            return new Contract(
            Optional.of(rs.getLong("id")),
            rs.getString("owner_name"),
            rs.getString("client_name"),
            readEquipment(rs.getString("equipment")),
            rs.getDate("start_date").toLocalDate(),
            rs.getDate("end_date").toLocalDate(),
            rs.getBigDecimal("total_value"),
            rs.getString("contract_text"),
            Optional.ofNullable(rs.getString("artifact_digest")),
            Optional.ofNullable(rs.getString("envelope_id")),
            ContractStatus.fromToken(status)
                .orElseThrow(() -> new SQLException("Unknown contract status: " + status)),
            instant(rs, "sent_at"),
            instant(rs, "completed_at"),
            instant(rs, "declined_at"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"),
            rs.getLong("version")
            );
        };
    }

    private static Optional<Instant> instant(ResultSet rs, String column) throws SQLException {
        return Optional.ofNullable(rs.getTimestamp(column)).map(Timestamp::toInstant);
    }

    private static Timestamp toTimestamp(Optional<Instant> value) {
        return value.map(Timestamp::from).orElse(null);
    }

    private String writeEquipment(List<String> refs) {
        try {
            return objectMapper.writeValueAsString(refs);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Equipment references are not serializable", e);
        }
    }

    private List<String> readEquipment(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt equipment column: " + json, e);
        }
    }
}
