package com.herzen.audit;

import com.herzen.audit.config.AuditProperties;
import com.herzen.audit.config.AuditProperties.ReleaseOrder;
import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.domain.DomainModels.Grade;
import com.herzen.audit.domain.DomainModels.Term;
import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.evaluation.EvaluationException;
import com.herzen.audit.evaluation.EvaluationModels.BlockResult;
import com.herzen.audit.evaluation.EvaluationModels.EvaluationOutcome;
import com.herzen.audit.evaluation.EvaluationModels.NodeKind;
import com.herzen.audit.evaluation.EvaluationModels.NodeVerdict;
import com.herzen.audit.evaluation.RuleEvaluator;
import com.herzen.audit.parser.BlockParser;
import com.herzen.audit.parser.RulePrinter;
import com.herzen.audit.validation.BlockLinker;
import com.herzen.audit.validation.LinkedCatalog;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleEvaluatorTest {
    private final BlockParser parser = new BlockParser(AuditProperties.defaults());
    private final BlockLinker linker = new BlockLinker();
    private final RuleEvaluator evaluator = evaluator(AuditProperties.defaults());

    @Test
    void appliesMatchingCoursesAndLeavesOthersUnused() {
        LinkedCatalog catalog = catalog("block MATH major = courses MATH 100-199 min 2 courses");
        Transcript transcript = transcript(
                course("MATH", 101, "3", Grade.A, "2020F"),
                course("MATH", 201, "3", Grade.B, "2021W"),
                course("MATH", 150, "3", Grade.A, "2021F"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "MATH");

        assertTrue(result.satisfied());
        assertEquals(List.of("MATH101", "MATH150"), codes(result.root().applied()));
        assertEquals(List.of("MATH201"), codes(result.unconsumed()));
        assertEquals(0, new BigDecimal("6").compareTo(result.root().appliedCredits()));
        assertEquals("2 courses from MATH 100-199", result.root().description());
    }

    @Test
    void reportsCreditShortfallForUnmatchedSet() {
        LinkedCatalog catalog = catalog("""
                block HUM core "Humanities" =
                    all-of { courses ENG* min 6 credits; courses HIST* min 3 credits }
                """);
        Transcript transcript = transcript(
                course("ENG", 101, "3", Grade.A, "2020F"),
                course("ENG", 102, "3", Grade.B, "2021W"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "HUM");

        assertFalse(result.satisfied());
        NodeVerdict root = result.root();
        assertEquals("needs 1 more of 2 requirements", root.shortfall());
        assertTrue(root.children().get(0).satisfied());
        assertEquals("needs 3 credits from HIST*", root.children().get(1).shortfall());
        assertTrue(result.unconsumed().isEmpty());
    }

    @Test
    void takesEarliestTermThenHighestCreditsAndStopsWhenMet() {
        LinkedCatalog catalog = catalog("block CS minor = courses CS* min 6 credits");
        Transcript transcript = transcript(
                course("CS", 101, "3", Grade.B, "2020F"),
                course("CS", 102, "4", Grade.B, "2020F"),
                course("CS", 201, "3", Grade.A, "2019F"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "CS");

        assertTrue(result.satisfied());
        assertEquals(List.of("CS201", "CS102"), codes(result.root().applied()));
        assertEquals(List.of("CS101"), codes(result.unconsumed()));
    }

    @Test
    void gradeFloorAcceptsPassAndSkipsLowGrades() {
        LinkedCatalog catalog = catalog("block HIST minor = courses HIST* min 2 courses grade at-least C");
        Transcript transcript = transcript(
                course("HIST", 101, "3", Grade.D, "2020F"),
                course("HIST", 102, "3", Grade.B, "2021W"),
                course("HIST", 103, "3", Grade.PASS, "2021S"),
                course("HIST", 104, "3", Grade.F, "2019F"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "HIST");

        assertTrue(result.satisfied());
        assertEquals(List.of("HIST102", "HIST103"), codes(result.root().applied()));
        assertEquals("2 courses from HIST* with grade C or better", result.root().description());
    }

    @Test
    void inProgressCoursesCountOnlyWhenEnabled() {
        String source = "block ART minor = courses ART* min 2 courses";
        Transcript transcript = transcript(
                course("ART", 101, "3", Grade.A, "2020F"),
                course("ART", 201, "3", Grade.IN_PROGRESS, "2021W"));

        BlockResult strict = evaluator.evaluate(catalog(source), transcript, "ART");
        assertFalse(strict.satisfied());
        assertEquals("needs 1 more course from ART*", strict.root().shortfall());

        RuleEvaluator lenient = evaluator(new AuditProperties(true, false, ReleaseOrder.MOST_RECENT_FIRST, 32, 0, true));
        assertTrue(lenient.evaluate(catalog(source), transcript, "ART").satisfied());
    }

    @Test
    void maximumReleasesMostRecentCoursesByDefault() {
        LinkedCatalog catalog = catalog("block MATH minor = courses MATH* min 4 courses max 2 courses");
        Transcript transcript = mathSeries();

        BlockResult result = evaluator.evaluate(catalog, transcript, "MATH");

        NodeVerdict max = result.root();
        assertEquals(NodeKind.MAXIMUM, max.kind());
        assertFalse(max.satisfied());
        assertEquals(List.of("MATH101", "MATH102"), codes(max.applied()));
        assertEquals("capped at 2 courses; released MATH301/2022F, MATH201/2021F", max.note());
        assertEquals("needs 2 more courses from MATH*", max.children().get(0).shortfall());
        assertEquals(List.of("MATH201", "MATH301"), codes(result.unconsumed()));
    }

    @Test
    void maximumCanReleaseEarliestCoursesInstead() {
        RuleEvaluator earliest = evaluator(new AuditProperties(false, false, ReleaseOrder.EARLIEST_FIRST, 32, 0, true));
        LinkedCatalog catalog = catalog("block MATH minor = courses MATH* min 4 courses max 2 courses");

        BlockResult result = earliest.evaluate(catalog, mathSeries(), "MATH");

        assertEquals(List.of("MATH201", "MATH301"), codes(result.root().applied()));
        assertEquals(List.of("MATH101", "MATH102"), codes(result.unconsumed()));
    }

    @Test
    void anyOfCountsFirstSatisfiedChildren() {
        String source = "block SCI core = any-of { courses BIO* min 3 courses; courses CHEM* min 1 course }";
        Transcript transcript = transcript(
                course("BIO", 101, "4", Grade.A, "2020F"),
                course("BIO", 102, "4", Grade.B, "2021W"),
                course("CHEM", 101, "4", Grade.B, "2021W"));

        BlockResult kept = evaluator.evaluate(catalog(source), transcript, "SCI");
        assertTrue(kept.satisfied());
        assertFalse(kept.root().children().get(0).counted());
        assertTrue(kept.root().children().get(1).counted());
        assertTrue(kept.unconsumed().isEmpty());

        RuleEvaluator releasing = evaluator(new AuditProperties(false, true, ReleaseOrder.MOST_RECENT_FIRST, 32, 0, true));
        BlockResult released = releasing.evaluate(catalog(source), transcript, "SCI");
        assertTrue(released.satisfied());
        assertEquals(List.of("BIO101", "BIO102"), codes(released.unconsumed()));
        assertTrue(released.root().children().get(0).applied().isEmpty());
        assertEquals(List.of("CHEM101"), codes(released.root().applied()));
    }

    @Test
    void conditionalChoosesBranchFromTranscriptTotals() {
        String source = """
                block UPPER major =
                    if total-credits >= 12 and gpa >= 3 then
                        courses CS 300-399 min 1 course
                    else
                        courses CS 100-199 min 2 courses
                """;
        Transcript junior = transcript(
                course("CS", 101, "4", Grade.A, "2020F"),
                course("CS", 102, "4", Grade.A, "2021W"),
                course("CS", 310, "4", Grade.B, "2021F"));
        Transcript freshman = transcript(
                course("CS", 101, "4", Grade.A, "2020F"),
                course("CS", 102, "4", Grade.C, "2021W"));

        NodeVerdict met = evaluator.evaluate(catalog(source), junior, "UPPER").root();
        assertTrue(met.satisfied());
        assertEquals("condition met", met.note());
        assertEquals(List.of("CS310"), codes(met.applied()));
        assertEquals("if total-credits >= 12 and gpa >= 3", met.description());

        NodeVerdict notMet = evaluator.evaluate(catalog(source), freshman, "UPPER").root();
        assertTrue(notMet.satisfied());
        assertEquals("condition not met", notMet.note());
        assertEquals(List.of("CS101", "CS102"), codes(notMet.applied()));
    }

    @Test
    void conditionalWithoutElseIsSatisfiedWhenConditionFails() {
        LinkedCatalog catalog = catalog("block HON concentration = if count-of(HON*) >= 1 then courses HON* min 3 courses");
        Transcript transcript = transcript(course("ENG", 101, "3", Grade.A, "2020F"));

        NodeVerdict root = evaluator.evaluate(catalog, transcript, "HON").root();

        assertTrue(root.satisfied());
        assertEquals("condition not met; no requirement", root.note());
        assertTrue(root.applied().isEmpty());
    }

    @Test
    void sharedReferenceLeavesCoursesAvailable() {
        LinkedCatalog catalog = catalog("""
                block MAJ major = all-of { courses CS* min 2 courses; ref CORE-REQ shared }
                block CORE-REQ core = courses CS 101 min 1 course
                """);
        Transcript transcript = transcript(
                course("CS", 101, "3", Grade.A, "2020F"),
                course("CS", 102, "3", Grade.A, "2020F"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "MAJ");

        assertTrue(result.satisfied());
        NodeVerdict ref = result.root().children().get(1);
        assertEquals(NodeKind.BLOCK_REFERENCE, ref.kind());
        assertEquals("shared: applied courses remain available", ref.note());
        assertEquals(List.of("CS101"), codes(ref.applied()));
    }

    @Test
    void exclusiveReferenceCompetesForCourses() {
        LinkedCatalog catalog = catalog("""
                block MAJ major = all-of { courses CS* min 2 courses; ref CORE-REQ }
                block CORE-REQ core = courses CS 101 min 1 course
                """);
        Transcript transcript = transcript(
                course("CS", 101, "3", Grade.A, "2020F"),
                course("CS", 102, "3", Grade.A, "2020F"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "MAJ");

        assertFalse(result.satisfied());
        NodeVerdict ref = result.root().children().get(1);
        assertEquals("block CORE-REQ is not satisfied", ref.shortfall());
        assertEquals("needs 1 course from CS 101", ref.children().get(0).shortfall());
    }

    @Test
    void exclusiveReferenceToEvaluatedBlockSeesOnlyRemainingCourses() {
        LinkedCatalog catalog = catalog("""
                block MAJ major = all-of { courses CS* min 2 courses; ref CORE-REQ }
                block CORE-REQ core = courses CS 101 min 1 course
                """);
        Transcript transcript = transcript(
                course("CS", 101, "3", Grade.A, "2020F"),
                course("CS", 102, "3", Grade.A, "2020F"));

        EvaluationOutcome outcome = evaluator.evaluate(catalog, transcript, List.of("CORE-REQ", "MAJ"));

        assertTrue(outcome.blocks().get(0).satisfied());
        NodeVerdict major = outcome.blocks().get(1).root();
        assertFalse(major.satisfied());
        assertEquals("needs 1 more course from CS*", major.children().get(0).shortfall());
        NodeVerdict ref = major.children().get(1);
        assertFalse(ref.satisfied());
        assertEquals("already evaluated in this run; its courses are spent", ref.note());
        assertTrue(ref.applied().isEmpty());
        assertEquals(List.of("CS102"), codes(major.applied()));
    }

    @Test
    void sameBlockReferencedTwiceExclusivelyCannotReuseCourses() {
        LinkedCatalog catalog = catalog("""
                block TWICE major = all-of { ref CORE; ref CORE }
                block CORE core = courses CS 101 min 1 course
                """);
        Transcript transcript = transcript(course("CS", 101, "3", Grade.A, "2020F"));

        NodeVerdict root = evaluator.evaluate(catalog, transcript, "TWICE").root();

        assertFalse(root.satisfied());
        assertTrue(root.children().get(0).satisfied());
        assertFalse(root.children().get(1).satisfied());
        assertEquals(List.of("CS101"), codes(root.applied()));
        assertEquals(0, new BigDecimal("3").compareTo(root.appliedCredits()));

        EvaluationOutcome outcome = evaluator.evaluate(catalog, transcript, List.of("CORE", "TWICE"));
        assertTrue(outcome.blocks().get(0).satisfied());
        assertFalse(outcome.blocks().get(1).satisfied());
        assertTrue(outcome.blocks().get(1).root().applied().isEmpty());
    }

    @Test
    void maximumCapsCoursesAppliedThroughReference() {
        LinkedCatalog catalog = catalog("""
                block CAP major = ref MULTI max 1 course
                block MULTI core = courses CS* min 2 courses
                """);
        Transcript transcript = transcript(
                course("CS", 101, "3", Grade.A, "2020F"),
                course("CS", 102, "3", Grade.A, "2021W"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "CAP");

        assertFalse(result.satisfied());
        assertEquals(List.of("CS101"), codes(result.root().applied()));
        assertEquals(List.of("CS102"), codes(result.unconsumed()));
        assertEquals("needs 1 more course from CS*", result.root().children().get(0).children().get(0).shortfall());
    }

    @Test
    void creditCeilingReleasesMostRecentCoursesAndRechecksChild() {
        LinkedCatalog catalog = catalog("block ELEC minor = courses ELEC* min 9 credits max 6 credits");
        Transcript transcript = transcript(
                course("ELEC", 101, "3", Grade.A, "2020F"),
                course("ELEC", 102, "3", Grade.B, "2021W"),
                course("ELEC", 201, "3", Grade.A, "2021F"));

        BlockResult result = evaluator.evaluate(catalog, transcript, "ELEC");

        NodeVerdict max = result.root();
        assertTrue(max.appliedCredits().compareTo(new BigDecimal("6")) <= 0);
        assertEquals(List.of("ELEC101", "ELEC102"), codes(max.applied()));
        assertEquals("capped at 6 credits; released ELEC201/2021F", max.note());

        NodeVerdict child = max.children().get(0);
        assertFalse(child.satisfied());
        assertEquals(0, new BigDecimal("6").compareTo(child.appliedCredits()));
        assertEquals("needs 3 more credits from ELEC*", child.shortfall());
        assertEquals(List.of("ELEC201"), codes(result.unconsumed()));
    }

    @Test
    void creditCeilingOnGroupReleasesLatestCourseAndRechecksChildren() {
        LinkedCatalog catalog = catalog("""
                block FREE core = all-of { courses ART* min 3 credits; courses MUS* min 2 credits } max 6 credits
                """);
        Transcript transcript = transcript(
                course("ART", 101, "3", Grade.A, "2020F"),
                course("MUS", 110, "4", Grade.B, "2021W"));

        NodeVerdict max = evaluator.evaluate(catalog, transcript, "FREE").root();

        assertFalse(max.satisfied());
        assertEquals(0, new BigDecimal("3").compareTo(max.appliedCredits()));
        NodeVerdict group = max.children().get(0);
        assertTrue(group.children().get(0).satisfied());
        assertFalse(group.children().get(1).satisfied());
        assertEquals("needs 2 credits from MUS*", group.children().get(1).shortfall());
    }

    @Test
    void unlinkedBlockIsAnEvaluationError() {
        LinkedCatalog catalog = catalog("block ONE core = courses A*");
        var ex = assertThrows(EvaluationException.class,
                () -> evaluator.evaluate(catalog, transcript(), "TWO"));
        assertEquals("UNRESOLVED_REFERENCE", ex.code());
    }

    @Test
    void repeatedRunsProduceEqualOutcomes() {
        LinkedCatalog catalog = catalog("""
                block BA major = all-of { 2-of { courses ENG*; courses HIST*; courses PHIL* }; ref LANG }
                block LANG core = courses FREN* min 2 courses
                """);
        Transcript transcript = transcript(
                course("ENG", 101, "3", Grade.A, "2020F"),
                course("PHIL", 101, "3", Grade.B, "2020F"),
                course("FREN", 101, "4", Grade.A, "2021W"),
                course("FREN", 102, "4", Grade.A, "2021S"),
                course("ART", 110, "2", Grade.A, "2021S"));

        EvaluationOutcome first = evaluator.evaluate(catalog, transcript, List.of("BA"));
        EvaluationOutcome second = evaluator.evaluate(catalog, transcript, List.of("BA"));

        assertEquals(first, second);
        assertTrue(first.blocks().get(0).satisfied());
    }

    @Test
    void everyCourseIsAppliedOnceOrUnused() {
        LinkedCatalog catalog = catalog("""
                block ENGR major = all-of {
                    courses MATH* min 2 courses;
                    any-of { courses PHYS* min 2 courses; courses CHEM* min 8 credits };
                    courses * min 6 credits max 6 credits
                }
                """);
        Transcript transcript = transcript(
                course("MATH", 101, "4", Grade.A, "2020F"),
                course("MATH", 102, "4", Grade.B, "2021W"),
                course("MATH", 201, "4", Grade.B, "2021F"),
                course("PHYS", 101, "4", Grade.A, "2020F"),
                course("CHEM", 101, "4", Grade.C, "2021W"),
                course("ART", 101, "3", Grade.A, "2021W"),
                course("MUS", 120, "3", Grade.FAIL, "2021S"));

        EvaluationOutcome outcome = evaluator.evaluate(catalog, transcript, List.of("ENGR"));

        List<Course> applied = outcome.blocks().get(0).root().applied();
        Set<Course> seen = new HashSet<>();
        applied.forEach(c -> assertTrue(seen.add(c), "applied twice: " + c));
        for (Course c : outcome.unusedCourses()) {
            assertFalse(seen.contains(c), "both applied and unused: " + c);
        }
        assertEquals(transcript.courses().size(), applied.size() + outcome.unusedCourses().size());
    }

    @Test
    void addingCoursesKeepsSatisfiedBlockSatisfied() {
        LinkedCatalog catalog = catalog("""
                block MATH major = all-of { courses MATH 100-199 min 2 courses; any-of { courses STAT*; courses CS* } }
                """);
        Transcript base = transcript(
                course("MATH", 101, "3", Grade.A, "2020F"),
                course("MATH", 150, "3", Grade.A, "2021F"),
                course("STAT", 200, "3", Grade.B, "2021F"));
        assertTrue(evaluator.evaluate(catalog, base, "MATH").satisfied());

        Transcript extended = base
                .with(course("MATH", 120, "3", Grade.B, "2019F"))
                .with(course("CS", 100, "3", Grade.A, "2019F"));
        assertTrue(evaluator.evaluate(catalog, extended, "MATH").satisfied());
    }

    private RuleEvaluator evaluator(AuditProperties properties) {
        return new RuleEvaluator(properties, new RulePrinter());
    }

    private LinkedCatalog catalog(String source) {
        return linker.link(parser.parse(source).allBlocks());
    }

    private static Transcript mathSeries() {
        return transcript(
                course("MATH", 101, "3", Grade.A, "2020F"),
                course("MATH", 102, "3", Grade.A, "2021W"),
                course("MATH", 201, "3", Grade.B, "2021F"),
                course("MATH", 301, "3", Grade.B, "2022F"));
    }

    static Transcript transcript(Course... courses) {
        return new Transcript("s-100", List.of(courses));
    }

    static Course course(String subject, int number, String credits, Grade grade, String term) {
        return new Course(subject, number, new BigDecimal(credits), grade, Term.parse(term), false);
    }

    static List<String> codes(List<Course> courses) {
        return courses.stream().map(Course::code).toList();
    }
}
