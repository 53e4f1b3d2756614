package com.fotogeo.core.update;

/**
 * An edited row names a file that is not in the photo folder.
 */
public class UnmatchedRowException extends Exception {

    public UnmatchedRowException(String filename) {
        super("no photo named '" + filename + "' in the folder");
    }
}
