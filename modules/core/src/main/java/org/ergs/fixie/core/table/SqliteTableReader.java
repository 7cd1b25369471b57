package org.ergs.fixie.core.table;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.Query;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads tables from SQLite databases, the output format of simulations
 * written with the {@code .sqlite} or {@code .db} extension.
 *
 * <p>Databases are opened read-only. Table and field names must be plain
 * identifiers; condition values are bound as parameters.
 */
@ApplicationScoped
public class SqliteTableReader implements TableReader {

    private static final Logger log = Logger.getLogger(SqliteTableReader.class);

    private static final Set<String> EXTENSIONS = Set.of("sqlite", "db");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    public boolean supports(String extension) {
        return EXTENSIONS.contains(extension);
    }

    @Override
    public Table read(Path artifact, String table, List<Condition> conditions) {
        checkIdentifier(table, "table");
        conditions.forEach(c -> checkIdentifier(c.field(), "field"));
        if (!Files.isRegularFile(artifact)) {
            throw new TableReadException(artifact + " does not exist or is not a file");
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        Jdbi jdbi = Jdbi.create("jdbc:sqlite:" + artifact, config.toProperties());

        try {
            return jdbi.withHandle(h -> {
                boolean exists = h.createQuery(
                                "SELECT count(*) FROM sqlite_master WHERE type IN ('table', 'view') AND name = :name")
                        .bind("name", table)
                        .mapTo(Integer.class)
                        .one() > 0;
                if (!exists) {
                    throw new TableReadException("No table " + table + " in " + artifact.getFileName());
                }
                Query query = h.createQuery(select(table, conditions));
                for (int i = 0; i < conditions.size(); i++) {
                    query.bind("v" + i, conditions.get(i).value());
                }
                return query.scanResultSet((results, ctx) -> toTable(results.get()));
            });
        } catch (JdbiException e) {
            log.warnf("Failed to read table %s from %s: %s", table, artifact, e.getMessage());
            throw new TableReadException("Could not read table " + table + ": " + e.getMessage(), e);
        }
    }

    static String select(String table, List<Condition> conditions) {
        StringBuilder sql = new StringBuilder("SELECT * FROM \"").append(table).append('"');
        for (int i = 0; i < conditions.size(); i++) {
            Condition c = conditions.get(i);
            sql.append(i == 0 ? " WHERE " : " AND ")
                    .append('"').append(c.field()).append("\" ")
                    .append(c.op().sql())
                    .append(" :v").append(i);
        }
        return sql.toString();
    }

    private static Table toTable(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new Table(columns, rows);
    }

    private static void checkIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new TableReadException("Invalid " + what + " name: " + name);
        }
    }
}
