package com.regvalidator.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regvalidator.domain.Transcript;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads transcript JSON from files or strings with Jackson and maps it to the domain.
 */
@Component
@RequiredArgsConstructor
public class TranscriptReader {

    private final ObjectMapper objectMapper;
    private final TranscriptMapper transcriptMapper;

    public Transcript read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_UNREADABLE,
                    "Cannot read transcript " + file + ": " + e.getMessage(), e);
        }
        return parse(json);
    }

    public Transcript parse(String json) {
        TranscriptDocument document;
        try {
            document = objectMapper.readValue(json, TranscriptDocument.class);
        } catch (JsonProcessingException e) {
            throw new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_UNREADABLE,
                    "Transcript is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return transcriptMapper.toDomain(document);
    }
}
