package com.zzf.koda.session;

import com.zzf.koda.core.change.StagedChange;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Staged changes of one task as served by {@code GET /api/tasks/{id}/changes}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSetView {
    private List<StagedChange> changes;
    private String diff;
    private String summary;
}
