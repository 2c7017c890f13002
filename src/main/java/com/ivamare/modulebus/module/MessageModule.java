package com.ivamare.modulebus.module;

import com.ivamare.modulebus.exception.RecipientFatalException;
import com.ivamare.modulebus.model.Message;
import com.ivamare.modulebus.model.MessageError;

/**
 * A module that receives messages from the dispatcher.
 *
 * <p>Every registered module receives every message, including the ones it sent.
 * Modules ignore messages they are not interested in, usually by checking
 * {@link Message#getType()} and {@link Message#getLevel()}.
 *
 * <p>Modules can report back through the message:
 * <ul>
 *   <li>{@link Message#addResponse} - data for the sender</li>
 *   <li>{@link Message#addError} with a {@link MessageError#warning warning} - logged only</li>
 *   <li>{@link Message#addError} with a {@link MessageError#fatal fatal error} - raised by the sender</li>
 * </ul>
 * Throwing from {@link #processMessage} is recorded as a fatal error.
 */
public interface MessageModule extends ModuleReference {

    /**
     * Process a message.
     *
     * <p>Must not keep a reference to the message after returning, unless it
     * {@linkplain DeliveryContext#defer() deferred} completion.
     *
     * @param message The message
     * @param context Delivery context
     * @throws Exception on processing failure
     */
    void processMessage(Message message, DeliveryContext context) throws Exception;

    /**
     * Called on the sender once a message it sent has finalized with responses.
     *
     * @param message The finalized message
     */
    default void handleResponses(Message message) {
    }

    /**
     * Called on the sender once for every fatal error attached to a message it sent.
     *
     * <p>By default the error is raised.
     *
     * @param message The finalized message
     * @param error The fatal error
     */
    default void handleError(Message message, MessageError error) {
        throw new RecipientFatalException(message.getType(), error.source(), error.message(), error.exception());
    }
}
