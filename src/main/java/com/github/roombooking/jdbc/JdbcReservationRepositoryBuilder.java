package com.github.roombooking.jdbc;

import com.github.roombooking.AbstractReservationRepositoryBuilder;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.internal.ReservationJsonCodec;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Builder for creating JDBC-backed {@link ReservationRepository} instances.
 */
public final class JdbcReservationRepositoryBuilder
        extends AbstractReservationRepositoryBuilder<JdbcReservationRepositoryBuilder> {

    private final DataSource dataSource;
    private String tableName = "RESERVATIONS";

    public JdbcReservationRepositoryBuilder(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    /**
     * Sets the table name for storing reservations. Default: "RESERVATIONS"
     *
     * <p>Note: The table must be created by the user. See {@link JdbcReservationRepository}
     * for the required schema.</p>
     *
     * @param tableName the table name (must not be null or empty)
     * @return this builder
     */
    public JdbcReservationRepositoryBuilder tableName(String tableName) {
        Objects.requireNonNull(tableName, "tableName must not be null");
        if (tableName.isEmpty()) {
            throw new IllegalArgumentException("tableName must not be empty");
        }
        this.tableName = tableName;
        return this;
    }

    @Override
    public ReservationRepository build() {
        validate();
        return new JdbcReservationRepository(dataSource, tableName, new ReservationJsonCodec(), meterRegistry);
    }
}
