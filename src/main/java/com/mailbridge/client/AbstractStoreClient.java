package com.mailbridge.client;

import com.mailbridge.config.AccountSettings;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.mime.MessageComposer;
import com.mailbridge.mime.MessageDecoder;
import com.mailbridge.service.MailTransport;
import jakarta.mail.Folder;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import lombok.extern.slf4j.Slf4j;

/**
 * Store and folder lifecycle for the retrieval variants.
 * The selected folder stays open until disconnect, so attachment parts of
 * fetched messages remain readable.
 */
@Slf4j
public abstract class AbstractStoreClient extends AbstractMailClient {

    protected final MessageDecoder decoder;
    protected final SearchScanner scanner;

    private Store store;
    private Folder folder;

    protected AbstractStoreClient(AccountSettings account, StoreConnector connector, MessageDecoder decoder,
                                  MessageComposer composer, MailTransport transport, SearchScanner scanner) {
        super(account, connector, composer, transport);
        this.decoder = decoder;
        this.scanner = scanner;
    }

    @Override
    public void connect() {
        if (state != ClientState.DISCONNECTED) {
            return;
        }
        store = connector.connect(account);
        state = ClientState.CONNECTED;
    }

    /**
     * Open the folder read-only, reusing it when already selected
     */
    protected Folder selectFolder(String name) {
        ensureConnected();
        if (folder != null && folder.isOpen() && folder.getFullName().equalsIgnoreCase(name)) {
            return folder;
        }
        closeFolder();
        try {
            Folder candidate = store.getFolder(name);
            if (!candidate.exists()) {
                throw MailBridgeException.validation("Folder not found: " + name);
            }
            candidate.open(Folder.READ_ONLY);
            folder = candidate;
            state = ClientState.FOLDER_SELECTED;
            log.debug("Selected folder {} ({} messages)", name, candidate.getMessageCount());
            return candidate;
        } catch (MessagingException e) {
            throw new MailBridgeException(ErrorKind.CONNECTION_FAILURE,
                    "Failed to open folder " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void disconnect() {
        if (state == ClientState.DISCONNECTED) {
            return;
        }
        closeFolder();
        if (store != null) {
            try {
                store.close();
            } catch (MessagingException e) {
                log.warn("Error while closing store for {}: {}", account.getAddress(), e.getMessage());
            }
        }
        store = null;
        state = ClientState.DISCONNECTED;
        log.info("Disconnected from {} server for {}", getProtocol().name(), account.getAddress());
    }

    private void closeFolder() {
        if (folder == null) {
            return;
        }
        try {
            if (folder.isOpen()) {
                folder.close(false);
            }
        } catch (MessagingException e) {
            log.warn("Error while closing folder {}: {}", folder.getFullName(), e.getMessage());
        }
        folder = null;
        if (state == ClientState.FOLDER_SELECTED) {
            state = ClientState.CONNECTED;
        }
    }
}
