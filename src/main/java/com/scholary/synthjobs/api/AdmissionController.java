package com.scholary.synthjobs.api;

import com.scholary.synthjobs.admission.AdmissionDecision;
import com.scholary.synthjobs.admission.AdmissionGate;
import com.scholary.synthjobs.admission.AdmissionKey;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Direct access to the admission gate for callers that guard their own expensive work. */
@RestController
@RequestMapping("/api/admission")
@Tag(name = "Admission", description = "Per-caller rate limits for expensive operations")
public class AdmissionController {

  private final AdmissionGate admissionGate;
  private final CallerIdentity callerIdentity;

  public AdmissionController(
      AdmissionGate admissionGate,
      @Value("${admission.trustProxyHeaders:false}") boolean trustProxyHeaders) {
    this.admissionGate = admissionGate;
    this.callerIdentity = new CallerIdentity(trustProxyHeaders);
  }

  @PostMapping("/check")
  @Operation(
      summary = "Check and consume admission budget",
      description =
          "Consumes budget exactly like a real request. Returns 200 when allowed and 429 with "
              + "Retry-After when the caller is over budget for the operation class.")
  public ResponseEntity<AdmissionCheckResponse> check(
      @Valid @RequestBody AdmissionCheckRequest request, HttpServletRequest httpRequest) {
    AdmissionKey key =
        AdmissionKey.of(callerIdentity.resolve(httpRequest), request.operationClass());
    AdmissionDecision decision =
        request.cost() == null
            ? admissionGate.tryAdmit(key)
            : admissionGate.tryAdmit(key, request.cost());

    AdmissionCheckResponse body = AdmissionCheckResponse.from(decision);
    if (decision.allowed()) {
      return ResponseEntity.ok(body);
    }
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(body.retryAfterSeconds()))
        .body(body);
  }
}
