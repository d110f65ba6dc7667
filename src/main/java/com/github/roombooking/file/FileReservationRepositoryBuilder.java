package com.github.roombooking.file;

import com.github.roombooking.AbstractReservationRepositoryBuilder;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.internal.ReservationJsonCodec;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Builder for creating file-backed {@link ReservationRepository} instances.
 *
 * <p>The file is created as an empty JSON array when the repository is built if it does
 * not exist yet.</p>
 */
public final class FileReservationRepositoryBuilder
        extends AbstractReservationRepositoryBuilder<FileReservationRepositoryBuilder> {

    private final Path path;

    public FileReservationRepositoryBuilder(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    /**
     * {@inheritDoc}
     *
     * @throws com.github.roombooking.ReservationStorageException if a missing file cannot be created
     */
    @Override
    public ReservationRepository build() {
        validate();
        return new FileReservationRepository(path, new ReservationJsonCodec(), meterRegistry);
    }
}
