package guardrail.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied description of an operation to audit.
 *
 * <p>An entry carries only what the caller knows. Id, timestamp, risk, compliance flags,
 * classification and the integrity hash are derived by {@link AuditTrail#logEvent(AuditEntry)}.
 * A data subject is given either as a raw identifier, which the trail hashes before anything
 * is buffered or logged, or as an existing 64-hex subject hash.
 *
 * <p>Entries are immutable and may be reused as templates via {@link #toBuilder()}.
 */
public final class AuditEntry {
  private final String actorId;
  private final AuditAction action;
  private final AuditResource resource;
  private final String sessionId;
  private final String rawSubjectId;
  private final String subjectHash;
  private final String resourceId;
  private final int outcomeCode;
  private final RiskLevel riskOverride;
  private final String ipAddress;
  private final Long durationMs;
  private final String errorMessage;
  private final Map<String, String> context;

  private AuditEntry(Builder builder) {
    this.actorId = Objects.requireNonNull(builder.actorId, "actorId");
    if (actorId.isEmpty()) {
      throw new IllegalArgumentException("actorId cannot be empty");
    }
    this.action = Objects.requireNonNull(builder.action, "action");
    this.resource = Objects.requireNonNull(builder.resource, "resource");
    if (builder.rawSubjectId != null && builder.subjectHash != null) {
      throw new IllegalArgumentException("Set either subject or subjectHash, not both");
    }
    if (builder.subjectHash != null && !IntegrityHasher.isHex64(builder.subjectHash)) {
      throw new IllegalArgumentException("subjectHash must be 64 lower-case hex characters");
    }
    if (builder.durationMs != null && builder.durationMs < 0) {
      throw new IllegalArgumentException("durationMs must be >= 0, got: " + builder.durationMs);
    }
    this.sessionId = builder.sessionId;
    this.rawSubjectId = builder.rawSubjectId;
    this.subjectHash = builder.subjectHash;
    this.resourceId = builder.resourceId;
    this.outcomeCode = builder.outcomeCode;
    this.riskOverride = builder.riskOverride;
    this.ipAddress = builder.ipAddress;
    this.durationMs = builder.durationMs;
    this.errorMessage = builder.errorMessage;

    Map<String, String> contextCopy = builder.context == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
    if (contextCopy.containsKey(null)) {
      throw new IllegalArgumentException("context cannot contain null keys");
    }
    if (contextCopy.containsValue(null)) {
      throw new IllegalArgumentException("context cannot contain null values");
    }
    this.context = contextCopy;
  }

  /**
   * @param actorId  the authenticated principal performing the operation
   * @param action   what was done
   * @param resource what it was done to
   */
  public static Builder builder(String actorId, AuditAction action, AuditResource resource) {
    return new Builder(actorId, action, resource);
  }

  public Builder toBuilder() {
    Builder b = new Builder(actorId, action, resource)
        .sessionId(sessionId)
        .resourceId(resourceId)
        .outcomeCode(outcomeCode)
        .riskLevel(riskOverride)
        .ipAddress(ipAddress)
        .errorMessage(errorMessage)
        .context(context);
    b.rawSubjectId = rawSubjectId;
    b.subjectHash = subjectHash;
    b.durationMs = durationMs;
    return b;
  }

  public String actorId() {
    return actorId;
  }

  public AuditAction action() {
    return action;
  }

  public AuditResource resource() {
    return resource;
  }

  public String sessionId() {
    return sessionId;
  }

  String rawSubjectId() {
    return rawSubjectId;
  }

  public String subjectHash() {
    return subjectHash;
  }

  public boolean hasSubject() {
    return rawSubjectId != null || subjectHash != null;
  }

  public String resourceId() {
    return resourceId;
  }

  public int outcomeCode() {
    return outcomeCode;
  }

  /**
   * @return the explicit risk level, or null to derive it from the action
   */
  public RiskLevel riskOverride() {
    return riskOverride;
  }

  public String ipAddress() {
    return ipAddress;
  }

  public Long durationMs() {
    return durationMs;
  }

  public String errorMessage() {
    return errorMessage;
  }

  public Map<String, String> context() {
    return context;
  }

  @Override
  public String toString() {
    // Raw subject deliberately omitted
    return "AuditEntry{actorId=" + actorId + ", action=" + action + ", resource=" + resource
        + ", outcomeCode=" + outcomeCode + '}';
  }

  /**
   * Builder for {@link AuditEntry}.
   */
  public static final class Builder {
    private final String actorId;
    private final AuditAction action;
    private final AuditResource resource;
    private String sessionId;
    private String rawSubjectId;
    private String subjectHash;
    private String resourceId;
    private int outcomeCode = 200;
    private RiskLevel riskOverride;
    private String ipAddress;
    private Long durationMs;
    private String errorMessage;
    private Map<String, String> context;

    private Builder(String actorId, AuditAction action, AuditResource resource) {
      this.actorId = actorId;
      this.action = action;
      this.resource = resource;
    }

    public Builder sessionId(String sessionId) {
      this.sessionId = sessionId;
      return this;
    }

    /**
     * Sets the raw identifier of the data subject. It is replaced by its keyed hash before the
     * event is built and never stored. Mutually exclusive with {@link #subjectHash}.
     *
     * @param rawSubjectId the identifier, e.g. a national id number
     * @return this builder
     */
    public Builder subject(String rawSubjectId) {
      this.rawSubjectId = rawSubjectId;
      return this;
    }

    /**
     * Sets an already pseudonymized subject. Mutually exclusive with {@link #subject}.
     *
     * @param subjectHash 64 lower-case hex characters
     * @return this builder
     */
    public Builder subjectHash(String subjectHash) {
      this.subjectHash = subjectHash;
      return this;
    }

    public Builder resourceId(String resourceId) {
      this.resourceId = resourceId;
      return this;
    }

    /**
     * Sets the HTTP-like outcome of the operation.
     *
     * <p>Optional. Defaults to {@code 200}.
     */
    public Builder outcomeCode(int outcomeCode) {
      this.outcomeCode = outcomeCode;
      return this;
    }

    /**
     * Overrides the risk derived from the action and outcome.
     *
     * <p>Optional. Defaults to {@code null} (derived).
     */
    public Builder riskLevel(RiskLevel riskLevel) {
      this.riskOverride = riskLevel;
      return this;
    }

    public Builder ipAddress(String ipAddress) {
      this.ipAddress = ipAddress;
      return this;
    }

    public Builder durationMs(long durationMs) {
      this.durationMs = durationMs;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    /**
     * Sets flat key-value context. The map is copied at build time.
     */
    public Builder context(Map<String, String> context) {
      this.context = context;
      return this;
    }

    /**
     * @throws NullPointerException     if actorId, action or resource is null
     * @throws IllegalArgumentException if both subject forms are set, the subject hash is
     *                                  malformed, or context contains nulls
     */
    public AuditEntry build() {
      return new AuditEntry(this);
    }
  }
}
