package com.vedant.analyticsbot.dto;

public class NLQueryRequestDTO {
    private String nlQuery;

    public NLQueryRequestDTO() {}

    public String getNlQuery() { return nlQuery; }
    public void setNlQuery(String nlQuery) { this.nlQuery = nlQuery; }
}
