package com.dnobretech.contentalignerbackend.util;

import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

@Component
public class TextNormalizer {
    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");   // 1+ espaços
    // mantém letras, dígitos, espaço, CJK e Hangul
    private static final Pattern SPECIAL_CHARS = Pattern.compile(
            "[^\\w\\s\\u4e00-\\u9fff\\uac00-\\ud7af]", Pattern.UNICODE_CHARACTER_CLASS);

    @Value("${aligner.preprocessing.min-content-length:3}")
    private int minContentLength = 3;

    @Value("${aligner.preprocessing.max-content-length:8000}")
    private int maxContentLength = 8000;

    @Value("${aligner.preprocessing.remove-special-characters:true}")
    private boolean removeSpecialCharacters = true;

    public String normalize(String s) {
        if (s == null) return "";
        String t = s.trim();                                                // tira espaços extremos
        t = Normalizer.normalize(t, Normalizer.Form.NFKC);                  // normaliza unicode
        t = MULTI_SPACE.matcher(t).replaceAll(" ");                         // colapsa espaços
        return t;
    }

    /** texto pronto pro embedding: sem HTML, entidades decodificadas, espaços colapsados */
    public String clean(String content) {
        if (content == null || content.isBlank()) return "";

        String t = stripHtml(content);
        t = normalize(t);
        if (removeSpecialCharacters) {
            t = SPECIAL_CHARS.matcher(t).replaceAll(" ");
            t = MULTI_SPACE.matcher(t).replaceAll(" ").trim();
        }
        return t;
    }

    public boolean isContentValid(String clean) {
        return clean != null
                && !clean.isBlank()
                && clean.length() >= minContentLength
                && clean.length() <= maxContentLength;
    }

    private static String stripHtml(String html) {
        // sem '<' nem '&' não há markup; evita parse à toa
        if (html.indexOf('<') < 0 && html.indexOf('&') < 0) return html;
        return Jsoup.parseBodyFragment(html).text();
    }
}
