package dtm.dao.repository.prototype.datasource;

public class SimpleDatabaseConfiguration extends AbstractDatabaseConfiguration<SimpleDatabaseConfiguration> {

    private final String dialect;

    public SimpleDatabaseConfiguration(String driverClassName, String url, String username, String password, String dialect) {
        super(driverClassName, url, username, password);
        this.dialect = dialect;
    }

    @Override
    public String getDialect() { return dialect; }

}
