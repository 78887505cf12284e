package com.staydesk.booking.domain.service;

import com.staydesk.booking.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;

/**
 * Guest-facing booking references of the form {@code BK-<base-36 epoch millis>-<4 random chars>},
 * e.g. {@code BK-LZ3K9Q2A-X7QF}.
 */
@Component
@RequiredArgsConstructor
public class BookingReferenceGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 4;
    private static final int MAX_ATTEMPTS = 5;

    private final BookingRepository bookingRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public String nextReference() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String reference = candidate();
            if (!bookingRepository.existsByReference(reference)) {
                return reference;
            }
        }
        throw new IllegalStateException("Could not generate a unique booking reference after " + MAX_ATTEMPTS + " attempts");
    }

    String candidate() {
        StringBuilder reference = new StringBuilder("BK-")
                .append(Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            reference.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return reference.toString();
    }
}
