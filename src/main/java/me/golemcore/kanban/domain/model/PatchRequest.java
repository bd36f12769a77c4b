package me.golemcore.kanban.domain.model;

/**
 * A follow-up change requested on a task whose run already finished.
 *
 * @param request
 *            free-text description of what to change
 * @param patchFile
 *            spec file the patch should follow, may be {@code null}
 */
public record PatchRequest(String request, String patchFile) {
}
