package com.fotogeo.core.export;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Columns shared by the CSV and the spreadsheet, in their fixed order. The update step reads the edited
 * table back through these header names.
 */
public enum TableColumns {
    NOME("Nome"),
    NOME_PERSONALIZADO("NomePersonalizado"),
    DESCRICAO("Descricao"),
    LATITUDE("Latitude"),
    LONGITUDE("Longitude"),
    ESTE("Este"),
    NORTE("Norte"),
    ZONA("Zona"),
    HEMISFERIO("Hemisferio"),
    DATA_HORA("DataHora");

    public static final Set<TableColumns> EDITABLE = Set.of(NOME_PERSONALIZADO, DESCRICAO);

    private final String header;

    TableColumns(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }

    public boolean isEditable() {
        return EDITABLE.contains(this);
    }

    public static List<String> headers() {
        return Arrays.stream(values()).map(TableColumns::header).toList();
    }
}
