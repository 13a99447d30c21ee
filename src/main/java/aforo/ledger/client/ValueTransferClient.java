package aforo.ledger.client;

import aforo.ledger.exception.TransferFailedException;

/**
 * External custody service that actually moves funds. The ledger treats any failure as
 * fatal to the enclosing operation.
 */
public interface ValueTransferClient {

    /**
     * Send {@code amount} from the ledger's custody account to {@code to}.
     *
     * @throws TransferFailedException if the service declines or cannot be reached
     */
    void transfer(String to, long amount);

    /**
     * Pull {@code amount} from {@code from} into {@code to}.
     *
     * @throws TransferFailedException if the service declines or cannot be reached
     */
    void transferFrom(String from, String to, long amount);
}
