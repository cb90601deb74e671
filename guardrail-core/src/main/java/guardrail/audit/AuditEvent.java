package guardrail.audit;

import guardrail.util.CanonicalJson;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable, signed record of one audited operation.
 *
 * <p>Instances are only created by {@link AuditTrail}. The integrity hash covers
 * {@link #canonicalForm()}; use {@link AuditTrail#verify(AuditEvent)} to check it.
 */
public final class AuditEvent {
  private final UUID id;
  private final Instant timestamp;
  private final String actorId;
  private final String sessionId;
  private final String subjectHash;
  private final AuditAction action;
  private final AuditResource resource;
  private final String resourceId;
  private final int outcomeCode;
  private final RiskLevel riskLevel;
  private final Set<ComplianceFlag> complianceFlags;
  private final DataClassification dataClassification;
  private final String ipAddress;
  private final Long durationMs;
  private final String errorMessage;
  private final Map<String, String> context;
  private final UUID correctsEventId;
  private final String integrityHash;

  AuditEvent(UUID id, Instant timestamp, String actorId, String sessionId, String subjectHash,
      AuditAction action, AuditResource resource, String resourceId, int outcomeCode,
      RiskLevel riskLevel, Set<ComplianceFlag> complianceFlags,
      DataClassification dataClassification, String ipAddress, Long durationMs,
      String errorMessage, Map<String, String> context, UUID correctsEventId,
      String integrityHash) {
    this.id = Objects.requireNonNull(id, "id");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.actorId = Objects.requireNonNull(actorId, "actorId");
    this.sessionId = sessionId;
    this.subjectHash = subjectHash;
    this.action = Objects.requireNonNull(action, "action");
    this.resource = Objects.requireNonNull(resource, "resource");
    this.resourceId = resourceId;
    this.outcomeCode = outcomeCode;
    this.riskLevel = Objects.requireNonNull(riskLevel, "riskLevel");
    this.complianceFlags = complianceFlags.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(complianceFlags));
    this.dataClassification = Objects.requireNonNull(dataClassification, "dataClassification");
    this.ipAddress = ipAddress;
    this.durationMs = durationMs;
    this.errorMessage = errorMessage;
    this.context = context;
    this.correctsEventId = correctsEventId;
    this.integrityHash = Objects.requireNonNull(integrityHash, "integrityHash");
  }

  /**
   * Fixed-order JSON over the identity and outcome fields; the input to the integrity hash.
   */
  public String canonicalForm() {
    return canonicalForm(id, timestamp, actorId, sessionId, subjectHash, action, resource,
        resourceId, outcomeCode, riskLevel, correctsEventId);
  }

  static String canonicalForm(UUID id, Instant timestamp, String actorId, String sessionId,
      String subjectHash, AuditAction action, AuditResource resource, String resourceId,
      int outcomeCode, RiskLevel riskLevel, UUID correctsEventId) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", id);
    fields.put("timestamp", timestamp);
    fields.put("actorId", actorId);
    fields.put("sessionId", sessionId);
    fields.put("subjectHash", subjectHash);
    fields.put("action", action.wireName());
    fields.put("resource", resource.wireName());
    fields.put("resourceId", resourceId);
    fields.put("outcomeCode", outcomeCode);
    fields.put("riskLevel", riskLevel.name());
    fields.put("correctsEventId", correctsEventId);
    return CanonicalJson.write(fields);
  }

  public UUID id() {
    return id;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String actorId() {
    return actorId;
  }

  public String sessionId() {
    return sessionId;
  }

  public String subjectHash() {
    return subjectHash;
  }

  public AuditAction action() {
    return action;
  }

  public AuditResource resource() {
    return resource;
  }

  public String resourceId() {
    return resourceId;
  }

  public int outcomeCode() {
    return outcomeCode;
  }

  public RiskLevel riskLevel() {
    return riskLevel;
  }

  public Set<ComplianceFlag> complianceFlags() {
    return complianceFlags;
  }

  public DataClassification dataClassification() {
    return dataClassification;
  }

  /**
   * @return true when a data subject is involved, so processing needs a consent basis
   */
  public boolean consentRequired() {
    return subjectHash != null;
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

  /**
   * @return id of the event this one corrects, or null
   */
  public UUID correctsEventId() {
    return correctsEventId;
  }

  public String integrityHash() {
    return integrityHash;
  }

  @Override
  public String toString() {
    return "AuditEvent{id=" + id + ", action=" + action.wireName()
        + ", resource=" + resource.wireName() + ", riskLevel=" + riskLevel
        + ", outcomeCode=" + outcomeCode + '}';
  }
}
