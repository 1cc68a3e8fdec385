package io.github.hotbrkm.campaignengine.agent.email.mime;

import jakarta.activation.DataHandler;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.Getter;

import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

@Getter
class MimeMessageBuilder {

    private static final String CRLF = "\r\n";
    private static final DateTimeFormatter RFC_2822_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.US);
    private static final String ENC_BASE64 = "base64";

    private final Session session;
    private final MimeMessage mimeMessage;
    private final MimeMultipart alternativeContent;
    private final MimeMultipart mixedContent;

    private String from;
    private String subject;
    private String to;
    private int partCount;
    private boolean isMixed;

    private final String charset = "UTF-8";
    private final String headerWordEncoding = "B";
    private String extensionHeader;

    MimeMessageBuilder() {
        session = Session.getInstance(new Properties());
        mimeMessage = new PreservedIdMimeMessage(session);
        alternativeContent = new MimeMultipart("alternative");
        mixedContent = new MimeMultipart("mixed");
    }

    public void setFrom(String name, String email) {
        from = formatAddress(name, email);
    }

    public void setTo(String name, String email) {
        to = formatAddress(name, email);
    }

    public void setSubject(String subject) {
        try {
            this.subject = MimeUtility.fold(9, MimeUtility.encodeText(subject.trim(), charset, headerWordEncoding));
        } catch (Exception ex) {
            this.subject = "";
        }
    }

    /**
     * Adds one part of the multipart/alternative body. Add text/plain before text/html.
     */
    public void addAlterContent(String contentType, String content) throws MessagingException {
        if (content == null || content.isEmpty()) {
            return;
        }
        MimeBodyPart bodyPart = new MimeBodyPart();
        bodyPart.setText(content, charset, getSubtype(contentType));
        bodyPart.setHeader("Content-Transfer-Encoding", ENC_BASE64);
        alternativeContent.addBodyPart(bodyPart);
        partCount++;
    }

    private String getSubtype(String contentType) {
        int slashIndex = contentType.indexOf('/');
        if (slashIndex != -1 && slashIndex < contentType.length() - 1) {
            return contentType.substring(slashIndex + 1);
        }
        return "html";
    }

    /**
     * Adds a file part. Once any is added the body becomes multipart/mixed with the alternative part first.
     */
    public void addAttachment(String fileName, byte[] content) throws MessagingException {
        MimeBodyPart attachmentPart = new MimeBodyPart();
        attachmentPart.setDataHandler(new DataHandler(new ByteArrayDataSource(content, getMimeType(fileName))));
        try {
            attachmentPart.setFileName(MimeUtility.encodeText(fileName.trim(), charset, headerWordEncoding));
        } catch (UnsupportedEncodingException e) {
            throw new MessagingException("Cannot encode attachment name " + fileName, e);
        }
        attachmentPart.setDisposition(MimeBodyPart.ATTACHMENT);
        attachmentPart.setHeader("Content-Transfer-Encoding", ENC_BASE64);

        mixedContent.addBodyPart(attachmentPart);
        isMixed = true;
    }

    public void addAttachments(Map<String, byte[]> attachmentFiles) throws MessagingException {
        for (Map.Entry<String, byte[]> entry : attachmentFiles.entrySet()) {
            addAttachment(entry.getKey(), entry.getValue());
        }
    }

    private String getMimeType(String fileName) {
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex == -1) {
            return "application/octet-stream";
        }
        String extension = fileName.substring(dotIndex).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case ".txt" -> "text/plain";
            case ".csv" -> "text/csv";
            case ".html", ".htm" -> "text/html";
            case ".pdf" -> "application/pdf";
            case ".zip" -> "application/zip";
            case ".jpg", ".jpeg" -> "image/jpeg";
            case ".png" -> "image/png";
            case ".gif" -> "image/gif";
            default -> "application/octet-stream";
        };
    }

    public void makeHeader(String messageId, ZonedDateTime date, Map<String, String> customHeader) throws MessagingException {
        mimeMessage.setHeader("Message-ID", messageId);
        mimeMessage.setHeader("From", from);
        mimeMessage.setHeader("To", to);
        mimeMessage.setHeader("Subject", subject);
        mimeMessage.setHeader("Date", date.format(RFC_2822_FORMATTER));
        mimeMessage.setHeader("MIME-Version", "1.0");
        mimeMessage.setHeader("Precedence", "bulk");

        for (Map.Entry<String, String> entry : customHeader.entrySet()) {
            mimeMessage.setHeader(entry.getKey(), entry.getValue());
        }
    }

    public void makeBody() throws MessagingException {
        if (isMixed) {
            if (partCount > 0) {
                MimeBodyPart alternativePart = new MimeBodyPart();
                alternativePart.setContent(alternativeContent);
                mixedContent.addBodyPart(alternativePart, 0);
            }
            mimeMessage.setContent(mixedContent);
        } else if (partCount == 0) {
            mimeMessage.setText("", charset);
        } else {
            mimeMessage.setContent(alternativeContent);
        }
        mimeMessage.saveChanges();
    }

    public void setExtension(String headerLine) {
        this.extensionHeader = headerLine;
    }

    private String formatAddress(String name, String email) {
        String address = "<" + email.trim() + ">";
        if (name == null || name.isBlank()) {
            return address;
        }
        try {
            return "\"" + MimeUtility.fold(9, MimeUtility.encodeText(name.trim(), charset, headerWordEncoding)) + "\" " + address;
        } catch (Exception ex) {
            return address;
        }
    }

    /**
     * Returns the MIME header and body as a String.
     */
    public String toString() {
        try {
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            mimeMessage.writeTo(outputStream);
            String result = outputStream.toString(Charset.forName(charset));

            if (extensionHeader != null) {
                return extensionHeader + CRLF + result;
            }
            return result;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to convert MimeMessage to String", e);
        }
    }

    /**
     * Keeps the Message-ID set in {@link #makeHeader} instead of the one saveChanges() would generate.
     */
    private static final class PreservedIdMimeMessage extends MimeMessage {
        PreservedIdMimeMessage(Session session) {
            super(session);
        }

        @Override
        protected void updateMessageID() {
        }
    }
}
