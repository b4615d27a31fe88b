package com.perm.status;

import com.perm.model.CaseStatus;
import com.perm.model.ProgressStatus;

/**
 * Case and progress status implied by the recorded milestones.
 */
public record AutoStatus(CaseStatus caseStatus, ProgressStatus progressStatus) {

    static AutoStatus of(CaseStatus caseStatus, ProgressStatus progressStatus) {
        return new AutoStatus(caseStatus, progressStatus);
    }
}
