package offlinesync;

/**
 * Outcome of a single {@link MessageDelivery#deliver} call.
 *
 * @param success     whether the backend accepted the message
 * @param deliveredId backend-assigned message id, or {@code null}
 * @param reason      failure reason when {@code success} is false, or {@code null}
 */
public record DeliveryResult(boolean success, String deliveredId, String reason) {

  public static DeliveryResult delivered(String deliveredId) {
    return new DeliveryResult(true, deliveredId, null);
  }

  public static DeliveryResult delivered() {
    return new DeliveryResult(true, null, null);
  }

  public static DeliveryResult failed(String reason) {
    return new DeliveryResult(false, null, reason);
  }
}
