package com.phonepe.soulwire.core.session;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Settings of a session that outlive a process: approval choices, subagents created at runtime and extra
 * directories the agent may work in
 */
@Value
@Builder
@Jacksonized
@With
public class SessionState {
    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int version = CURRENT_VERSION;

    @Builder.Default
    ApprovalSettings approval = ApprovalSettings.builder().build();

    @Builder.Default
    List<DynamicSubagent> dynamicSubagents = List.of();

    @Builder.Default
    List<String> additionalDirs = List.of();

    @Value
    @Builder
    @Jacksonized
    @With
    public static class ApprovalSettings {
        boolean yolo;

        @Builder.Default
        List<String> autoApproveActions = List.of();
    }

    @Value
    @Builder
    @Jacksonized
    public static class DynamicSubagent {
        @NonNull
        String name;

        @NonNull
        String systemPrompt;
    }

    public static SessionState defaults() {
        return SessionState.builder().build();
    }

    /**
     * Copy where every section that is null, such as an explicit <code>null</code> in a stored file, is replaced
     * by its default. Null list entries are dropped.
     */
    public SessionState normalized() {
        final var approvalSettings = null == approval ? ApprovalSettings.builder().build() : approval;
        return SessionState.builder()
                .version(version)
                .approval(approvalSettings.withAutoApproveActions(nonNullEntries(
                        approvalSettings.getAutoApproveActions())))
                .dynamicSubagents(nonNullEntries(dynamicSubagents))
                .additionalDirs(nonNullEntries(additionalDirs))
                .build();
    }

    private static <T> List<T> nonNullEntries(List<T> entries) {
        if (null == entries) {
            return List.of();
        }
        return entries.stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
