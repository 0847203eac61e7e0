package org.geoloader.dxf;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DxfGroupCodeScannerTest {

    @Test
    void tokenize_acceptsMixedLineEndingsAndSkipsComments() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        String content = "999\r\nexported by test\r\n0\r\nSECTION\n2\rENTITIES\n0\nENDSEC\n0\nEOF\n";

        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize(content, reporter);

        assertThat(pairs).extracting(GroupCode::code).containsExactly(0, 2, 0, 0);
        assertThat(pairs).extracting(GroupCode::value).containsExactly("SECTION", "ENTITIES", "ENDSEC", "EOF");
        assertThat(reporter.list()).isEmpty();
    }

    @Test
    void tokenize_stripsByteOrderMark() {
        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize("\uFEFF0\nSECTION\n2\nHEADER\n0\nENDSEC\n", new DiagnosticsReporter());

        assertThat(pairs.get(0).code()).isEqualTo(0);
        assertThat(pairs.get(0).value()).isEqualTo("SECTION");
    }

    @Test
    void tokenize_keepsLeadingSpacesOfTextValues() {
        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize("1\n  indented  \n8\n  Layer1  \n", new DiagnosticsReporter());

        assertThat(pairs.get(0).value()).isEqualTo("  indented");
        assertThat(pairs.get(1).value()).isEqualTo("Layer1");
    }

    @Test
    void tokenize_nonIntegerCodeIsWarnedAndSkipped() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        String content = """
                abc
                junk
                0
                SECTION
                2
                HEADER
                0
                ENDSEC
                """;

        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize(content, reporter);

        assertThat(pairs).hasSize(3);
        assertThat(reporter.contains(DiagnosticCode.INVALID_GROUP_CODE)).isTrue();
        assertThat(reporter.list().get(0).context()).containsEntry("line", 1);
    }

    @Test
    void tokenize_trailingCodeWithoutValueIsWarned() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();

        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize("0\nSECTION\n2\nENTITIES\n0\nENDSEC\n5\n", reporter);

        assertThat(pairs).hasSize(3);
        assertThat(reporter.contains(DiagnosticCode.INVALID_GROUP_CODE)).isTrue();
    }

    @Test
    void tokenize_emptyContentIsFatal() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();

        assertThatThrownBy(() -> DxfGroupCodeScanner.tokenize("  \n ", reporter))
                .isInstanceOf(DxfParseException.class)
                .satisfies(e -> assertThat(((DxfParseException) e).getCode()).isEqualTo(DiagnosticCode.EMPTY_CONTENT));
        assertThatThrownBy(() -> DxfGroupCodeScanner.tokenize(null, reporter))
                .isInstanceOf(DxfParseException.class);
        assertThat(reporter.contains(DiagnosticCode.EMPTY_CONTENT)).isTrue();
    }

    @Test
    void tokenize_textWithoutAnyValidPairIsMalformed() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();

        assertThatThrownBy(() -> DxfGroupCodeScanner.tokenize("not a dxf", reporter))
                .isInstanceOf(DxfParseException.class)
                .satisfies(e -> assertThat(((DxfParseException) e).getCode()).isEqualTo(DiagnosticCode.MALFORMED_DXF));
    }

    @Test
    void tokenize_binarySentinelIsRejected() {
        assertThatThrownBy(() -> DxfGroupCodeScanner.tokenize("AutoCAD Binary DXF\r\n\u001a\u0000", new DiagnosticsReporter()))
                .isInstanceOf(DxfParseException.class)
                .satisfies(e -> assertThat(((DxfParseException) e).getCode()).isEqualTo(DiagnosticCode.BINARY_DXF));
    }

    @Test
    void sections_splitsByMarkersAndUppercasesNames() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize("""
                0
                SECTION
                2
                header
                9
                $ACADVER
                1
                AC1027
                0
                ENDSEC
                0
                SECTION
                2
                ENTITIES
                0
                POINT
                10
                1
                20
                2
                0
                ENDSEC
                0
                EOF
                """, reporter);

        List<DxfSection> sections = DxfGroupCodeScanner.sections(pairs, reporter);

        assertThat(sections).extracting(DxfSection::name).containsExactly("HEADER", "ENTITIES");
        assertThat(sections).allMatch(DxfSection::terminated);
        assertThat(sections.get(1).codes()).hasSize(3);
        assertThat(reporter.list()).isEmpty();
    }

    @Test
    void sections_missingEndsecRunsToNextSectionWithWarning() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize("""
                0
                SECTION
                2
                HEADER
                9
                $INSUNITS
                70
                6
                0
                SECTION
                2
                ENTITIES
                0
                ENDSEC
                """, reporter);

        List<DxfSection> sections = DxfGroupCodeScanner.sections(pairs, reporter);

        assertThat(sections).hasSize(2);
        assertThat(sections.get(0).terminated()).isFalse();
        assertThat(sections.get(0).codes()).hasSize(2);
        assertThat(sections.get(1).terminated()).isTrue();
        assertThat(reporter.contains(DiagnosticCode.UNTERMINATED_SECTION)).isTrue();
    }

    @Test
    void sections_noSectionMarkerIsFatal() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize("0\nLINE\n8\n0\n", reporter);

        assertThatThrownBy(() -> DxfGroupCodeScanner.sections(pairs, reporter))
                .isInstanceOf(DxfParseException.class)
                .satisfies(e -> assertThat(((DxfParseException) e).getCode()).isEqualTo(DiagnosticCode.MISSING_SECTIONS));
    }
}
