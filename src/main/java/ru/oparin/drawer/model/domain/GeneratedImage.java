package ru.oparin.drawer.model.domain;

import lombok.Value;

/**
 * Готовое изображение, полученное от бэкенда (байты + MIME тип).
 */
@Value
public class GeneratedImage {
    byte[] data;
    String mimeType;
}
