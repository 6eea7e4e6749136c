package com.ethica.lang.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The name tables the ethics checker matches against. Disallowed fragments and
 * both hint lists are matched case-insensitively and are stored lowercased.
 */
public final class EthicsPolicy {
    private static final EthicsPolicy DEFAULTS = buildDefaults();

    private final Set<String> consentRequired;
    private final Set<String> protectionRequired;
    private final Map<String, String> disallowed;
    private final List<String> sensitiveVariableHints;
    private final List<String> secretHints;
    private final String consentAnnotation;
    private final String protectionAnnotation;

    public EthicsPolicy(Set<String> consentRequired, Set<String> protectionRequired,
                        Map<String, String> disallowed, List<String> sensitiveVariableHints,
                        List<String> secretHints, String consentAnnotation, String protectionAnnotation) {
        this.consentRequired = Set.copyOf(consentRequired);
        this.protectionRequired = Set.copyOf(protectionRequired);
        Map<String, String> lowered = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : disallowed.entrySet()) {
            lowered.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        this.disallowed = Collections.unmodifiableMap(lowered);
        this.sensitiveVariableHints = lowercase(sensitiveVariableHints);
        this.secretHints = lowercase(secretHints);
        this.consentAnnotation = Objects.requireNonNull(consentAnnotation, "consentAnnotation");
        this.protectionAnnotation = Objects.requireNonNull(protectionAnnotation, "protectionAnnotation");
    }

    private static List<String> lowercase(List<String> names) {
        List<String> out = new ArrayList<>(names.size());
        for (String n : names) out.add(n.toLowerCase(Locale.ROOT));
        return List.copyOf(out);
    }

    public static EthicsPolicy defaults() { return DEFAULTS; }

    /** Functions that need {@link #consentAnnotation()} to be defined or called. */
    public Set<String> consentRequired() { return consentRequired; }

    /** Functions that need {@link #protectionAnnotation()}. */
    public Set<String> protectionRequired() { return protectionRequired; }

    /** Operation name fragment to the reason it is refused. */
    public Map<String, String> disallowed() { return disallowed; }

    /** Substrings marking a variable as holding sensitive data. */
    public List<String> sensitiveVariableHints() { return sensitiveVariableHints; }

    /** Substrings marking a string literal as a likely secret. */
    public List<String> secretHints() { return secretHints; }

    public String consentAnnotation() { return consentAnnotation; }
    public String protectionAnnotation() { return protectionAnnotation; }

    private static EthicsPolicy buildDefaults() {
        Set<String> consent = Set.of(
                "collect_location", "get_gps", "track_location", "get_location",
                "collect_biometric", "get_fingerprint", "get_face", "scan_face",
                "record_audio", "access_microphone", "record_video", "access_camera",
                "collect_contacts", "read_contacts", "access_contacts",
                "read_messages", "access_messages", "read_sms",
                "track_user", "track_behavior", "log_activity", "monitor_user",
                "collect_data", "collect_personal_info", "gather_user_data");

        Set<String> protection = Set.of(
                "store_password", "save_password", "store_credential",
                "store_payment", "process_payment", "save_card",
                "store_ssn", "store_personal_id", "save_sensitive_data");

        Map<String, String> disallowed = new LinkedHashMap<>();
        disallowed.put("facial_recognition", "Facial recognition systems are ethically problematic");
        disallowed.put("emotion_detection", "Emotion detection from faces is ethically problematic");
        disallowed.put("deepfake", "Deepfake generation is prohibited");
        disallowed.put("manipulate_ui", "UI manipulation (dark patterns) is prohibited");
        disallowed.put("hide_unsubscribe", "Hiding unsubscribe options is a dark pattern");
        disallowed.put("fake_urgency", "Creating fake urgency is manipulative");
        disallowed.put("confuse_user", "Deliberately confusing users is unethical");
        disallowed.put("trick_into_purchase", "Tricking users into purchases is prohibited");
        disallowed.put("hidden_charges", "Hidden charges are unethical");

        return new EthicsPolicy(consent, protection, disallowed,
                List.of("password", "ssn", "credit_card", "secret_key", "api_key"),
                List.of("password", "secret", "api_key", "token"),
                "requires_user_consent", "requires_data_protection");
    }
}
