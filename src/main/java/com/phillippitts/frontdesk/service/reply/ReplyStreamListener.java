package com.phillippitts.frontdesk.service.reply;

/**
 * Receives one streamed reply. Calls arrive sequentially from the generator's thread.
 */
public interface ReplyStreamListener {

    void onFragment(String fragment);

    /**
     * @param fullText complete reply as reported by the provider, may be null
     */
    void onComplete(String fullText);

    void onError(Throwable error);
}
