package offlinesync;

/**
 * Transport used by the sync coordinator to send one queued message to the backend.
 *
 * <p>Implementations are called from a delivery thread, one message at a time.
 * Throwing any exception or returning {@link DeliveryResult#failed(String)} counts
 * as a failed attempt. The queue sends no idempotency key, so a transport that
 * reaches the backend but reports failure may cause a duplicate on retry.
 */
@FunctionalInterface
public interface MessageDelivery {

  /**
   * Delivers a message.
   *
   * @param chatId      the conversation the message belongs to
   * @param payloadJson the opaque payload given at enqueue time
   * @return the delivery outcome
   * @throws Exception if delivery failed
   */
  DeliveryResult deliver(String chatId, String payloadJson) throws Exception;
}
