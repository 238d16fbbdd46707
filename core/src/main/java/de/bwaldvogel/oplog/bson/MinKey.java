package de.bwaldvogel.oplog.bson;

public final class MinKey implements Bson {

    private static final long serialVersionUID = 1L;

    private static final MinKey INSTANCE = new MinKey();

    private MinKey() {
    }

    public static MinKey getInstance() {
        return INSTANCE;
    }

    private Object readResolve() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "MinKey";
    }

}
