package io.devhire.marketplace.payment;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.CurrentActor;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PaymentController {

  private final PaymentService paymentService;

  public PaymentController(PaymentService paymentService) {
    this.paymentService = paymentService;
  }

  @PostMapping("/api/tasks/{taskId}/payment")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<PaymentResponse> payTask(
      @CurrentActor Actor actor, @PathVariable UUID taskId) {
    var payment = paymentService.pay(actor, taskId);
    return ResponseEntity.created(URI.create("/api/payments/" + payment.getId()))
        .body(PaymentResponse.from(payment));
  }

  @GetMapping("/api/payments/mine")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<List<PaymentResponse>> listMyPayments(@CurrentActor Actor actor) {
    return ResponseEntity.ok(
        paymentService.listMine(actor).stream().map(PaymentResponse::from).toList());
  }

  @GetMapping("/api/payments/{id}")
  public ResponseEntity<PaymentResponse> getPayment(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(PaymentResponse.from(paymentService.get(actor, id)));
  }

  public record PaymentResponse(
      UUID id, UUID taskId, UUID buyerId, BigDecimal amount, Instant createdAt) {

    public static PaymentResponse from(Payment payment) {
      return new PaymentResponse(
          payment.getId(),
          payment.getTaskId(),
          payment.getBuyerId(),
          payment.getAmount(),
          payment.getCreatedAt());
    }
  }
}
