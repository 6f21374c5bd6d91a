package com.mailbridge.client;

/**
 * Connection state of a {@link MailClient}
 */
public enum ClientState {
    DISCONNECTED,
    CONNECTED,
    FOLDER_SELECTED
}
