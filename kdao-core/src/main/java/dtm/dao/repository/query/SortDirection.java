package dtm.dao.repository.query;

public enum SortDirection {
    ASCENDING,
    DESCENDING
}
