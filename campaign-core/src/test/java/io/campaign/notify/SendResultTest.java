package io.campaign.notify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SendResultTest {

    @Test
    void sentIsSharedAndSuccessful() {
        assertSame(SendResult.sent(), SendResult.sent());
        assertTrue(SendResult.sent().isSuccess());
    }

    @Test
    void failedCarriesItsReason() {
        SendResult result = SendResult.failed("mailbox full");

        assertFalse(result.isSuccess());
        assertEquals("mailbox full", ((SendResult.Failed) result).reason());
        assertThrows(NullPointerException.class, () -> SendResult.failed(null));
    }

    @Test
    void channelsMayReturnTheirOwnResultType() {
        SendResult queued = new Queued("msg-42");

        assertFalse(queued.isSuccess());
        assertFalse(queued instanceof SendResult.Failed);
    }

    private record Queued(String messageId) implements SendResult {
    }
}
