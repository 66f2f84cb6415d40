package com.jdc.foodgram.domain.type;

public enum Role {
    USER,
    ADMIN
}
