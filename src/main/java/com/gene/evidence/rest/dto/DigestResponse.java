package com.gene.evidence.rest.dto;

import java.time.LocalDate;

public record DigestResponse(String date, String digest) {

    public static DigestResponse of(LocalDate date, String markdown) {
        return new DigestResponse(date.toString(), markdown);
    }
}
