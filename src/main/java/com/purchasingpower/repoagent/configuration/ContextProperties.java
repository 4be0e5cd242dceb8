package com.purchasingpower.repoagent.configuration;

import com.purchasingpower.repoagent.model.ContextBudget;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ContextProperties {

    @Min(0)
    private int maxSelectedFiles = 10;

    @Min(0)
    private int maxCharsPerFile = 1000;

    @Min(0)
    private int maxTreeEntriesPerLevel = 10;

    /**
     * Files fed to the generate workflow.
     */
    @Min(0)
    private int generateFiles = 5;

    /**
     * Similar files shown as style reference by the create workflow.
     */
    @Min(0)
    private int styleReferenceFiles = 3;

    /**
     * Paths kept from the search stage of the autonomous workflow.
     */
    @Min(0)
    private int autonomousFiles = 5;

    /**
     * Characters of repository context repeated in the implementation stage of solve.
     */
    @Min(0)
    private int implementationContextChars = 3000;

    public ContextBudget toBudget() {
        return new ContextBudget(maxSelectedFiles, maxCharsPerFile, maxTreeEntriesPerLevel);
    }
}
