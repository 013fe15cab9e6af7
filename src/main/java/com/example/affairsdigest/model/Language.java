package com.example.affairsdigest.model;

public enum Language {
    TRANSLATED,
    ORIGINAL
}
