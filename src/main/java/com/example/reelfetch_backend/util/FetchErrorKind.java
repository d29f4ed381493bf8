package com.example.reelfetch_backend.util;

public enum FetchErrorKind {
    CONNECTION,
    NOT_FOUND,
    FORBIDDEN,
    OTHER
}
