package kvstore.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the key-value store and its timeout manager.
 *
 * @see KvStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "kvstore")
public class KvStoreProperties {

    /**
     * Storage backend.
     */
    private Type type = Type.FILE;

    /**
     * Declared tables. Empty means {@code main}; {@code timeout} is always added.
     */
    private List<String> tables = new ArrayList<>();

    /**
     * Log a line once the store is established.
     */
    private boolean logging = true;

    /**
     * Start the timeout manager and connect the store with the application context.
     */
    private boolean autoStartup = true;

    private final File file = new File();
    private final Jdbc jdbc = new Jdbc();
    private final Mongo mongo = new Mongo();
    private final Firestore firestore = new Firestore();
    private final Metrics metrics = new Metrics();

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables;
    }

    public boolean isLogging() {
        return logging;
    }

    public void setLogging(boolean logging) {
        this.logging = logging;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public File getFile() {
        return file;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Mongo getMongo() {
        return mongo;
    }

    public Firestore getFirestore() {
        return firestore;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Type {
        FILE,
        JDBC,
        MONGO,
        FIRESTORE
    }

    public static class File {
        private String path = "./database/";
        private String extension = ".json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getExtension() {
            return extension;
        }

        public void setExtension(String extension) {
            this.extension = extension;
        }
    }

    public static class Jdbc {
        private String tablePrefix = "kv_";
        /**
         * Dialect name ({@code h2}, {@code mysql}, {@code postgresql}); detected from the
         * connection when empty.
         */
        private String dialect = "";

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public String getDialect() {
            return dialect;
        }

        public void setDialect(String dialect) {
            this.dialect = dialect;
        }
    }

    public static class Mongo {
        private String uri;
        private String database = "kvstore";

        public String getUri() {
            return uri;
        }

        public void setUri(String uri) {
            this.uri = uri;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }
    }

    public static class Firestore {
        private String projectId;
        /**
         * {@code host:port} of a Firestore emulator; credentials are skipped when set.
         */
        private String emulatorHost;

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getEmulatorHost() {
            return emulatorHost;
        }

        public void setEmulatorHost(String emulatorHost) {
            this.emulatorHost = emulatorHost;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "kvstore";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
