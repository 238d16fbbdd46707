package de.bwaldvogel.oplog.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

import de.bwaldvogel.oplog.bson.Document;

class ScriptedOplogSource implements OplogSource {

    private final Deque<Supplier<Document>> steps = new ArrayDeque<>();
    private boolean exhaustWhenDrained;
    private boolean closed;
    private int reads;

    ScriptedOplogSource empty() {
        steps.add(() -> null);
        return this;
    }

    ScriptedOplogSource empty(int times) {
        for (int i = 0; i < times; i++) {
            empty();
        }
        return this;
    }

    ScriptedOplogSource document(Document document) {
        steps.add(() -> document);
        return this;
    }

    ScriptedOplogSource failure(RuntimeException exception) {
        steps.add(() -> {
            throw exception;
        });
        return this;
    }

    ScriptedOplogSource failures(int times) {
        for (int i = 0; i < times; i++) {
            failure(new IllegalStateException("failure " + (i + 1)));
        }
        return this;
    }

    ScriptedOplogSource thenExhausted() {
        exhaustWhenDrained = true;
        return this;
    }

    @Override
    public Document tryNext() {
        reads++;
        Supplier<Document> step = steps.poll();
        if (step == null) {
            throw new IllegalStateException("script is drained");
        }
        return step.get();
    }

    @Override
    public boolean isExhausted() {
        return closed || (exhaustWhenDrained && steps.isEmpty());
    }

    @Override
    public void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    int getReads() {
        return reads;
    }

    @Override
    public String toString() {
        return "ScriptedOplogSource";
    }

}
