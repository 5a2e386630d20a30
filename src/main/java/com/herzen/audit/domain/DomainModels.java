package com.herzen.audit.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DomainModels {
    public record Course(String subject, int number, BigDecimal credits, Grade grade, Term term, boolean repeat) {
        public Course {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(credits, "credits");
            Objects.requireNonNull(grade, "grade");
            Objects.requireNonNull(term, "term");
            if (credits.signum() < 0) {
                throw new IllegalArgumentException("Negative credits for " + subject + " " + number);
            }
            subject = subject.toUpperCase(Locale.ROOT);
        }

        public CourseKey key() {
            return new CourseKey(subject, number, term);
        }

        public String code() {
            return subject + number;
        }

        @Override
        public String toString() {
            return code() + "/" + term.code();
        }
    }

    public record CourseKey(String subject, int number, Term term) {}

    public enum Grade {
        F(0), D(1), C(2), B(3), A(4), PASS(-1), FAIL(-1), TRANSFER(-1), IN_PROGRESS(-1);

        private final int points;

        Grade(int points) {
            this.points = points;
        }

        public boolean isLetter() {
            return points >= 0;
        }

        public int points() {
            return points;
        }

        public boolean earnsCredit() {
            return this != F && this != FAIL && this != IN_PROGRESS;
        }

        /** PASS and TRANSFER satisfy any floor; letter grades compare by points. */
        public boolean meets(Grade floor) {
            if (floor == null) return true;
            if (this == PASS || this == TRANSFER) return true;
            return isLetter() && floor.isLetter() && points >= floor.points;
        }
    }

    public enum Session {
        WINTER("W"), SPRING("S"), SUMMER("U"), FALL("F");

        private final String code;

        Session(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        static Session fromCode(String code) {
            for (Session s : values()) {
                if (s.code.equalsIgnoreCase(code)) return s;
            }
            throw new IllegalArgumentException("Unknown session code: " + code);
        }
    }

    public record Term(int year, Session session) implements Comparable<Term> {
        private static final Pattern TERM_PATTERN = Pattern.compile("^(\\d{4})([A-Za-z])$");
        private static final Comparator<Term> ORDER = Comparator.comparingInt(Term::year).thenComparing(Term::session);

        public Term {
            Objects.requireNonNull(session, "session");
        }

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static Term parse(String code) {
            Matcher m = TERM_PATTERN.matcher(code == null ? "" : code.trim());
            if (!m.matches()) {
                throw new IllegalArgumentException("Term must look like 2021F, got: " + code);
            }
            return new Term(Integer.parseInt(m.group(1)), Session.fromCode(m.group(2)));
        }

        @JsonValue
        public String code() {
            return year + session.code();
        }

        @Override
        public int compareTo(Term other) {
            return ORDER.compare(this, other);
        }
    }

    public record Transcript(String studentId, List<Course> courses) {
        public Transcript {
            courses = courses == null ? List.of() : List.copyOf(courses);
            Set<CourseKey> seen = new HashSet<>();
            for (Course c : courses) {
                if (!seen.add(c.key())) {
                    throw new IllegalArgumentException("Duplicate course occurrence: " + c);
                }
            }
        }

        public Transcript with(Course course) {
            List<Course> extended = new ArrayList<>(courses);
            extended.add(course);
            return new Transcript(studentId, extended);
        }
    }

    public enum BlockType { MAJOR, MINOR, CORE, CONCENTRATION }
}
