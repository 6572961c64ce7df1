package dtm.dao.repository.query;

import java.util.Objects;

public record SortProperty(String property, SortDirection direction) {

    public SortProperty {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(direction, "direction");
    }

    public boolean isAscending() {
        return direction == SortDirection.ASCENDING;
    }
}
