package com.example.goserver.model.domain;

public enum StoneColor {
    BLACK("B"),
    WHITE("W");

    private final String code;

    StoneColor(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public StoneColor opposite() {
        return this == BLACK ? WHITE : BLACK;
    }
}
