package com.photoorg.app.metadata;

import java.time.LocalDate;

/**
 * Ano/mês de captura de uma mídia.
 */
public record CaptureDate(int year, int month) {

    public CaptureDate {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Mes invalido: " + month);
        }
        if (year < 1 || year > 9999) {
            throw new IllegalArgumentException("Ano invalido: " + year);
        }
    }

    public static CaptureDate of(LocalDate date) {
        return new CaptureDate(date.getYear(), date.getMonthValue());
    }

    public String yearText() {
        return String.format("%04d", year);
    }

    /** Mês sempre com dois dígitos (04, 11). */
    public String monthText() {
        return String.format("%02d", month);
    }
}
