package space.ketterling.liveview.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies an idempotent DDL script from the classpath.
 */
public final class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String DEFAULT_SCRIPT = "db/schema.sql";

    private SchemaMigrator() {
    }

    /**
     * Runs each statement of the script in one transaction.
     */
    public static int apply(DataSource ds, String resource) throws Exception {
        List<String> statements = statements(readResource(resource));
        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (Statement st = c.createStatement()) {
                for (String sql : statements) {
                    st.execute(sql);
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
        log.info("Applied {} ({} statements)", resource, statements.size());
        return statements.size();
    }

    /**
     * Splits on ';' at line ends and strips "--" comment lines.
     */
    static List<String> statements(String script) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\r?\n")) {
            if (line.trim().startsWith("--"))
                continue;
            cleaned.append(line).append('\n');
        }
        List<String> out = new ArrayList<>();
        for (String part : cleaned.toString().split(";\\s*(\n|$)")) {
            if (!part.isBlank())
                out.add(part.trim());
        }
        return out;
    }

    private static String readResource(String resource) throws Exception {
        try (InputStream in = SchemaMigrator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("Schema resource not found: " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
