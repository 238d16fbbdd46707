package de.bwaldvogel.oplog.bson;

public final class MaxKey implements Bson {

    private static final long serialVersionUID = 1L;

    private static final MaxKey INSTANCE = new MaxKey();

    private MaxKey() {
    }

    public static MaxKey getInstance() {
        return INSTANCE;
    }

    private Object readResolve() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "MaxKey";
    }

}
