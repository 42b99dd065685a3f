package com.williamcallahan.pdfrag.service.retrieval;

import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Recognizes small talk that never needs document context: greetings, thanks, farewells,
 * confirmations, questions about the assistant itself, and anything too short to carry intent.
 */
@Component
public class TrivialQueryFilter {
    static final int MIN_QUERY_LENGTH = 5;

    private static final Set<String> SMALL_TALK = Set.of(
            // greetings
            "hola", "hla", "ola", "hi", "hey", "hello", "buenos días", "buenos dias", "buen dia", "buen día",
            "buenas tardes", "buenas noches", "buenas", "saludos", "good morning", "good afternoon",
            // how are you
            "como estás", "cómo estás", "como estas", "qué tal", "que tal", "todo bien",
            "bien y tú", "bien y tu", "how are you",
            // thanks
            "gracias", "gracia", "grcias", "muchas gracias", "te agradezco", "thanks", "thank you",
            "thx", "genial", "perfecto", "excelente",
            // farewells
            "adios", "adiós", "chao", "chau", "bye", "goodbye", "hasta luego", "hasta pronto",
            "nos vemos", "cuídate",
            // confirmations
            "ok", "okey", "okay", "vale", "sí", "si", "no", "yes", "entendido", "de acuerdo", "claro", "listo",
            // about the assistant
            "ayuda", "help", "quien eres", "quién eres", "como te llamas", "cómo te llamas",
            "qué puedes hacer", "que puedes hacer");

    public boolean isTrivial(String query) {
        if (query == null) {
            return true;
        }
        String normalized = query.strip().toLowerCase(Locale.ROOT);
        while (!normalized.isEmpty() && isTrailingPunctuation(normalized.charAt(normalized.length() - 1))) {
            normalized = normalized.substring(0, normalized.length() - 1).stripTrailing();
        }
        if (normalized.startsWith("¿") || normalized.startsWith("¡")) {
            normalized = normalized.substring(1).stripLeading();
        }
        return normalized.length() < MIN_QUERY_LENGTH || SMALL_TALK.contains(normalized);
    }

    private static boolean isTrailingPunctuation(char c) {
        return c == '!' || c == '?' || c == '.' || c == ',';
    }
}
