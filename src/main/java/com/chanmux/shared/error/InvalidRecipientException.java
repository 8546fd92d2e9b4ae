package com.chanmux.shared.error;

public class InvalidRecipientException extends ChanMuxException {

    public InvalidRecipientException(String recipient) {
        super("INVALID_WHATSAPP_NUMBER", "Recipient is not registered: " + recipient);
    }
}
