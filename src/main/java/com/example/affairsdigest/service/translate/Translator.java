package com.example.affairsdigest.service.translate;

import com.example.affairsdigest.exception.TranslationException;

public interface Translator {
    String translate(String text, String targetLanguage) throws TranslationException;
}
