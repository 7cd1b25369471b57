package org.ergs.fixie.core.table;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.ergs.fixie.core.paths.Outcome;
import org.ergs.fixie.core.paths.PathService;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads a table out of the artifact behind a registered path.
 */
@ApplicationScoped
public class TableService {

    private static final Logger log = Logger.getLogger(TableService.class);

    private final PathService pathService;
    private final List<TableReader> readers;
    private final TableFormatter formatter;

    @Inject
    public TableService(PathService pathService, Instance<TableReader> readers, TableFormatter formatter) {
        this(pathService, readers.stream().toList(), formatter);
    }

    public TableService(PathService pathService, List<TableReader> readers, TableFormatter formatter) {
        this.pathService = pathService;
        this.readers = List.copyOf(readers);
        this.formatter = formatter;
    }

    /**
     * Reads {@code table} from the artifact registered at {@code path},
     * filtered by {@code conditions} and rendered in {@code format}.
     */
    public Outcome<Object> table(String user, String path, String table, List<Condition> conditions,
                                 TableFormat format, TableOrient orient) {
        Outcome<Path> artifact = pathService.resolveArtifact(user, path);
        if (!artifact.ok()) {
            return artifact.propagate();
        }
        String extension = extension(artifact.value());
        Optional<TableReader> reader = readers.stream()
                .filter(r -> r.supports(extension))
                .findFirst();
        if (reader.isEmpty()) {
            return Outcome.failure("Cannot read tables from " + path
                    + ": unsupported file extension '" + extension + "'");
        }
        try {
            Table rows = reader.get().read(artifact.value(), table,
                    conditions == null ? List.of() : new ArrayList<>(conditions));
            log.debugf("Read %d row(s) of %s from %s for %s", rows.size(), table, path, user);
            return Outcome.success(formatter.format(rows, format, orient), "Table read");
        } catch (TableReadException e) {
            return Outcome.failure(e.getMessage());
        }
    }

    static String extension(Path artifact) {
        String name = artifact.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
