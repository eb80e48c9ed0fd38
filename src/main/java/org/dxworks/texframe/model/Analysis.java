package org.dxworks.texframe.model;

/**
 * Marker interface for analysis result types.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
