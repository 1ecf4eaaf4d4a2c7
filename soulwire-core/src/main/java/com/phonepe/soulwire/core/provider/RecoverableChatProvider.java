package com.phonepe.soulwire.core.provider;

import com.phonepe.soulwire.core.errors.ChatProviderException;

/**
 * A provider that can repair itself after a connection failure, for example by recreating its HTTP client
 */
public interface RecoverableChatProvider extends ChatProvider {

    /**
     * @param error The connection error that was raised
     * @return true if the provider recovered and the call should be made again
     */
    boolean recover(ChatProviderException error);
}
