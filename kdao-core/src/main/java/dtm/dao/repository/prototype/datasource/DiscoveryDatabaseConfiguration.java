package dtm.dao.repository.prototype.datasource;

public class DiscoveryDatabaseConfiguration extends AbstractDatabaseConfiguration<DiscoveryDatabaseConfiguration> {

    public DiscoveryDatabaseConfiguration(String driverClassName, String url, String username, String password) {
        super(driverClassName, url, username, password);
    }

    @Override
    public String getDialect() {
        return discoverDialect(getUrl());
    }

    public static String discoverDialect(String url) {
        if (url == null) return null;

        String cleanUrl = url.toLowerCase().trim();

        if (cleanUrl.startsWith("jdbc:postgresql:")) {
            return "org.hibernate.dialect.PostgreSQLDialect";
        }
        else if (cleanUrl.startsWith("jdbc:mysql:") || cleanUrl.startsWith("jdbc:mariadb:")) {
            return "org.hibernate.dialect.MySQLDialect";
        }
        else if (cleanUrl.startsWith("jdbc:oracle:")) {
            return "org.hibernate.dialect.OracleDialect";
        }
        else if (cleanUrl.startsWith("jdbc:sqlserver:")) {
            return "org.hibernate.dialect.SQLServerDialect";
        }
        else if (cleanUrl.startsWith("jdbc:h2:")) {
            return "org.hibernate.dialect.H2Dialect";
        }

        throw new IllegalArgumentException("Não foi possível detectar o dialeto automaticamente para a URL: " + url);
    }

}
