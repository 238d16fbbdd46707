package de.bwaldvogel.oplog.operation;

interface OplogFields {
    String OPERATION_TYPE = "op";
    String HASH = "h";
    String TIMESTAMP = "ts";
    String NAMESPACE = "ns";
    String O = "o";
}
