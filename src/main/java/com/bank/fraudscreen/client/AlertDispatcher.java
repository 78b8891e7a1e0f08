package com.bank.fraudscreen.client;

import com.bank.fraudscreen.model.AlertRecord;
import com.bank.fraudscreen.model.DispatchReceipt;

/**
 * Outbound channel for fraud alerts.
 */
public interface AlertDispatcher {

    /**
     * @throws RemoteCallException when the channel rejects the alert
     */
    DispatchReceipt send(AlertRecord alert);
}
