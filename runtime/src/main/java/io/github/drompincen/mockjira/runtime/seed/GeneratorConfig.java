package io.github.drompincen.mockjira.runtime.seed;

/**
 * Knobs of {@link SeedGenerator}. Any component left {@code null} takes its default, so a partial
 * JSON body is a valid config.
 */
public record GeneratorConfig(
        Long seed,
        Integer days,
        Integer softwareProjects,
        Integer serviceDeskProjects,
        Integer issuesPerProject,
        Integer boardsPerSoftwareProject,
        Integer sprintsPerBoard,
        Integer sprintLengthDays,
        Double commentsPerIssueAvg,
        Double transitionRate,
        Double linkProbability,
        Double assigneeChurnProbability
) {

    public GeneratorConfig {
        seed = seed != null ? seed : 42L;
        days = Math.max(1, days != null ? days : 120);
        softwareProjects = Math.max(0, softwareProjects != null ? softwareProjects : 1);
        serviceDeskProjects = Math.max(0, serviceDeskProjects != null ? serviceDeskProjects : 1);
        issuesPerProject = Math.max(0, issuesPerProject != null ? issuesPerProject : 80);
        boardsPerSoftwareProject = Math.max(0, boardsPerSoftwareProject != null ? boardsPerSoftwareProject : 1);
        sprintsPerBoard = Math.max(0, sprintsPerBoard != null ? sprintsPerBoard : 8);
        sprintLengthDays = Math.max(1, sprintLengthDays != null ? sprintLengthDays : 14);
        commentsPerIssueAvg = commentsPerIssueAvg != null ? commentsPerIssueAvg : 2.0;
        transitionRate = transitionRate != null ? transitionRate : 0.75;
        linkProbability = linkProbability != null ? linkProbability : 0.15;
        assigneeChurnProbability = assigneeChurnProbability != null ? assigneeChurnProbability : 0.25;
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
