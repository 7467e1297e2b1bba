package com.disassembly.service.storage;

import java.io.IOException;

/**
 * Byte storage for product files. Uploading is handled elsewhere; the composition service only
 * removes bytes whose metadata rows it deleted.
 */
public interface FileStorage {

    /**
     * Delete the stored bytes. Deleting something that is already gone is not an error.
     */
    void delete(String storagePath) throws IOException;
}
