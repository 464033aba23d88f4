package com.example.goserver.model.domain;

public enum ColorPreference {
    BLACK,
    WHITE,
    RANDOM
}
