package com.afipvision.core.extraction;

import com.afipvision.core.validation.ChecksumValidators;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CandidateScorerTest {

    private final ChecksumValidators v = ChecksumValidators.defaults();

    @Test
    void cuitWithValidChecksumScoresFull() {
        FieldShape cuit = FieldKind.CUIT.shape(v);
        assertEquals(1.0, CandidateScorer.score("20123456786", cuit), 1e-9);
        // та же форма, неверная контрольная цифра: теряется только балл за checksum
        assertEquals(0.75, CandidateScorer.score("20123456780", cuit), 1e-9);
    }

    @Test
    void companyKeywordGivesBonus() {
        FieldShape name = FieldKind.NAME.shape(v).withKeywords(FieldPatternLibrary.COMPANY_KEYWORDS);
        assertEquals(1.0, CandidateScorer.score("ACME S.A", name), 1e-9);
        assertEquals(2.0 / 3.0, CandidateScorer.score("Juan Pérez", name), 1e-9);
    }

    @Test
    void emptyScoresZero() {
        assertEquals(0.0, CandidateScorer.score("", FieldKind.TEXT.shape(v)));
        assertEquals(0.0, CandidateScorer.score(null, FieldKind.TEXT.shape(v)));
    }

    @Test
    void cleanCollapsesSpacesAndTrimsPunctuation() {
        assertEquals("ACME S.A", CandidateScorer.clean("  :ACME   S.A.;  "));
        assertEquals("", CandidateScorer.clean(null));
        assertEquals("", CandidateScorer.clean(" .;: "));
    }

    @Test
    void stopWordsAndShapeViolationsAreRejected() {
        FieldShape text = FieldKind.TEXT.shape(v);
        assertFalse(CandidateScorer.isAcceptable("de", text));
        assertFalse(CandidateScorer.isAcceptable("  ", text));
        assertTrue(CandidateScorer.isAcceptable("Av. Siempreviva 742", text));
        // буква в CUIT — жёсткий отказ
        assertFalse(CandidateScorer.isAcceptable("2012345678O", FieldKind.CUIT.shape(v)));
    }

    @Test
    void keywordsMatchIgnoringAccents() {
        FieldShape inst = FieldKind.NAME.shape(v).withKeywords(FieldPatternLibrary.INSTITUTION_KEYWORDS);
        double withKw = CandidateScorer.score("Facultad de Ingeniería", inst);
        double without = CandidateScorer.score("Ingeniería Civil", inst);
        assertTrue(withKw > without);
    }
}
