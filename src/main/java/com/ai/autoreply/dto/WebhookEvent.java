package com.ai.autoreply.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Inbound gateway event (Evolution API {@code messages.upsert} shape).
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookEvent {

    private static final String JID_SUFFIX = "@s.whatsapp.net";

    private String event;
    private String instance;
    private Data data;

    public String messageId() {
        return data != null && data.getKey() != null ? data.getKey().getId() : null;
    }

    public boolean isFromOwner() {
        return data != null && data.getKey() != null && data.getKey().isFromMe();
    }

    /** Contact phone number with the gateway's JID suffix removed, or null. */
    public String phoneNumber() {
        if (data == null || data.getKey() == null || StringUtils.isBlank(data.getKey().getRemoteJid())) {
            return null;
        }
        return StringUtils.removeEnd(data.getKey().getRemoteJid().trim(), JID_SUFFIX);
    }

    public MessageBody message() {
        return data != null ? data.getMessage() : null;
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        private Key key;
        private MessageBody message;
        private Long messageTimestamp;
        private String pushName;
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Key {
        private String remoteJid;
        private boolean fromMe;
        private String id;
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageBody {
        private String conversation;
        private ExtendedText extendedTextMessage;
        private Media audioMessage;
        private Media imageMessage;
        private Media documentMessage;

        public String plainText() {
            if (StringUtils.isNotBlank(conversation)) return conversation;
            if (extendedTextMessage != null && StringUtils.isNotBlank(extendedTextMessage.getText())) {
                return extendedTextMessage.getText();
            }
            return null;
        }
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtendedText {
        private String text;
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Media {
        private String url;
        private String mimetype;
        private String caption;
        private String title;
        private String fileName;
        private Integer seconds;
        private Boolean ptt;
    }
}
