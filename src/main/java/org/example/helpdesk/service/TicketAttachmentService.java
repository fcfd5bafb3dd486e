package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.HelpdeskProperties;
import org.example.helpdesk.entity.TicketPhoto;
import org.example.helpdesk.exception.InvalidAttachmentException;
import org.example.helpdesk.exception.InvalidAttachmentException.Reason;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Base64;

/**
 * Validates and encodes the photo uploaded with a new ticket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketAttachmentService {

    private final HelpdeskProperties properties;

    /**
     * Turn an uploaded file into a {@link TicketPhoto}.
     *
     * @param file the uploaded part, may be null or empty
     * @return the encoded photo, or null when no file was sent
     * @throws InvalidAttachmentException if the file is not an image, exceeds the size ceiling
     *                                    or cannot be read
     */
    public TicketPhoto toPhoto(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return null;
        }

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new InvalidAttachmentException(Reason.NOT_AN_IMAGE,
                    "Only image files are allowed, got: " + contentType);
        }

        long maxBytes = properties.upload().maxFileSize().toBytes();
        if (file.getSize() > maxBytes) {
            throw new InvalidAttachmentException(Reason.TOO_LARGE,
                    "File too large. Maximum size is " + properties.upload().maxFileSizeLabel());
        }

        try {
            byte[] bytes = file.getBytes();
            log.debug("Encoding photo {} ({} bytes, {})", file.getOriginalFilename(), bytes.length, contentType);
            return TicketPhoto.builder()
                    .data(Base64.getEncoder().encodeToString(bytes))
                    .contentType(contentType)
                    .size(bytes.length)
                    .build();
        } catch (IOException e) {
            throw new InvalidAttachmentException(Reason.UNREADABLE, "Uploaded photo could not be read", e);
        }
    }
}
