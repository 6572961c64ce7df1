package dtm.dao.bootstrap;

import dtm.dao.repository.exceptions.DatabaseInitializationException;
import dtm.dao.repository.prototype.datasource.AbstractDatabaseConfiguration;
import dtm.dao.repository.prototype.datasource.DiscoveryDatabaseConfiguration;

import java.util.Properties;

/**
 * Configuração lida de chaves {@code kdao.*}. Quando {@code kdao.dialect} não
 * é informado, o dialeto é descoberto pela URL JDBC.
 */
public class PropertiesDatabaseConfiguration extends AbstractDatabaseConfiguration<PropertiesDatabaseConfiguration> {

    public static final String DRIVER = "kdao.driver";
    public static final String URL = "kdao.url";
    public static final String USERNAME = "kdao.username";
    public static final String PASSWORD = "kdao.password";
    public static final String DIALECT = "kdao.dialect";
    public static final String HBM2DDL_AUTO = "kdao.hbm2ddl-auto";
    public static final String SHOW_SQL = "kdao.show-sql";
    public static final String FORMAT_SQL = "kdao.format-sql";
    public static final String POOL_MAXIMUM_SIZE = "kdao.pool.maximum-size";
    public static final String POOL_MINIMUM_IDLE = "kdao.pool.minimum-idle";
    public static final String POOL_CONNECTION_TIMEOUT = "kdao.pool.connection-timeout";
    public static final String POOL_IDLE_TIMEOUT = "kdao.pool.idle-timeout";
    public static final String SHUTDOWN_HOOK = "kdao.shutdown-hook";
    public static final String ENTITIES = "kdao.entities";

    private final String dialect;

    public PropertiesDatabaseConfiguration(Properties properties) {
        super(
                trimmed(properties, DRIVER),
                trimmed(properties, URL),
                trimmed(properties, USERNAME),
                properties.getProperty(PASSWORD)
        );
        this.dialect = trimmed(properties, DIALECT);

        String hbm2ddlAuto = trimmed(properties, HBM2DDL_AUTO);
        if (hbm2ddlAuto != null) withHbm2ddlAuto(hbm2ddlAuto);

        String showSql = trimmed(properties, SHOW_SQL);
        if (showSql != null) withShowSql(Boolean.parseBoolean(showSql));

        String formatSql = trimmed(properties, FORMAT_SQL);
        if (formatSql != null) withFormatSql(Boolean.parseBoolean(formatSql));

        String shutdownHook = trimmed(properties, SHUTDOWN_HOOK);
        if (shutdownHook != null) withShutdownHook(Boolean.parseBoolean(shutdownHook));

        String maximumPoolSize = trimmed(properties, POOL_MAXIMUM_SIZE);
        if (maximumPoolSize != null) withMaximumPoolSize(parseInteger(POOL_MAXIMUM_SIZE, maximumPoolSize));

        String minimumIdle = trimmed(properties, POOL_MINIMUM_IDLE);
        if (minimumIdle != null) withMinimumIdle(parseInteger(POOL_MINIMUM_IDLE, minimumIdle));

        String connectionTimeout = trimmed(properties, POOL_CONNECTION_TIMEOUT);
        if (connectionTimeout != null) withConnectionTimeout(parseNumber(POOL_CONNECTION_TIMEOUT, connectionTimeout));

        String idleTimeout = trimmed(properties, POOL_IDLE_TIMEOUT);
        if (idleTimeout != null) withIdleTimeout(parseNumber(POOL_IDLE_TIMEOUT, idleTimeout));

        String entities = trimmed(properties, ENTITIES);
        if (entities != null) {
            for (String entityName : entities.split(",")) {
                if (!entityName.isBlank()) {
                    withEntities(loadEntityClass(entityName.trim()));
                }
            }
        }
    }

    @Override
    public String getDialect() {
        return dialect != null ? dialect : DiscoveryDatabaseConfiguration.discoverDialect(getUrl());
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) return null;
        return value.trim();
    }

    private static int parseInteger(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new DatabaseInitializationException("Valor inteiro inválido para '" + key + "': " + value, e);
        }
    }

    private static long parseNumber(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new DatabaseInitializationException("Valor numérico inválido para '" + key + "': " + value, e);
        }
    }

    private static Class<?> loadEntityClass(String className) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = PropertiesDatabaseConfiguration.class.getClassLoader();
        }

        try {
            return Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new DatabaseInitializationException("Classe de entidade declarada em '" + ENTITIES + "' não encontrada: " + className, e);
        }
    }
}
