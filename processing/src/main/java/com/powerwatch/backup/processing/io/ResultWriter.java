package com.powerwatch.backup.processing.io;

import java.util.Collection;

public interface ResultWriter extends AutoCloseable {
    void writeHeader(String[] header);

    void writeRows(Collection<String[]> rows);

    @Override
    void close();
}
