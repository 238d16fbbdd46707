package de.bwaldvogel.oplog.bson;

import java.util.Objects;

public final class BsonRegularExpression implements Bson {

    private static final long serialVersionUID = 1L;

    private final String pattern;
    private final String options;

    public BsonRegularExpression(String pattern, String options) {
        this.pattern = Objects.requireNonNull(pattern);
        this.options = Objects.requireNonNull(options);
    }

    public String getPattern() {
        return pattern;
    }

    public String getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BsonRegularExpression other = (BsonRegularExpression) o;
        return pattern.equals(other.pattern) && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, options);
    }

    @Override
    public String toString() {
        return "/" + pattern + "/" + options;
    }

}
