package com.sealpost.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A hosted file referenced by a message, carried as an {@code imeta} tag on the inner message.
 * Upload and hosting happen elsewhere; only the descriptor travels with the message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attachment(String url, String mimeType, Long size, String name, List<String> hashes) {

    public Attachment {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Attachment url is required");
        }
        hashes = hashes == null ? List.of() : List.copyOf(hashes);
    }

    public List<String> toImetaTag() {
        List<String> tag = new ArrayList<>();
        tag.add("imeta");
        tag.add("url " + url);
        if (mimeType != null && !mimeType.isBlank()) {
            tag.add("m " + mimeType);
        }
        if (size != null && size > 0) {
            tag.add("size " + size);
        }
        if (name != null && !name.isBlank()) {
            tag.add("alt " + name);
        }
        hashes.forEach(hash -> tag.add("x " + hash));
        return tag;
    }

    public static Optional<Attachment> fromImetaTag(List<String> tag) {
        if (tag.isEmpty() || !"imeta".equals(tag.get(0))) {
            return Optional.empty();
        }
        String url = null;
        String mime = null;
        Long size = null;
        String name = null;
        List<String> hashes = new ArrayList<>();
        for (String entry : tag.subList(1, tag.size())) {
            int space = entry.indexOf(' ');
            if (space <= 0) {
                continue;
            }
            String key = entry.substring(0, space);
            String value = entry.substring(space + 1).trim();
            switch (key) {
                case "url" -> url = value;
                case "m" -> mime = value;
                case "alt" -> name = value;
                case "x" -> hashes.add(value);
                case "size" -> {
                    try {
                        size = Long.parseLong(value);
                    } catch (NumberFormatException e) {
                        size = null;
                    }
                }
                default -> {
                }
            }
        }
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new Attachment(url, mime, size, name, hashes));
    }

    public static List<Attachment> fromTags(List<List<String>> tags) {
        List<Attachment> attachments = new ArrayList<>();
        for (List<String> tag : tags) {
            fromImetaTag(tag).ifPresent(attachments::add);
        }
        return attachments;
    }

    /** Message text with the attachment URLs appended, one per line. */
    public static String appendUrls(String content, List<Attachment> attachments) {
        if (attachments.isEmpty()) {
            return content;
        }
        String urls = String.join("\n", attachments.stream().map(Attachment::url).toList());
        return content == null || content.isEmpty() ? urls : content + "\n\n" + urls;
    }
}
