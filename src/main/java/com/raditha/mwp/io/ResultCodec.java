package com.raditha.mwp.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.mwp.algebra.Delta;
import com.raditha.mwp.algebra.Monomial;
import com.raditha.mwp.algebra.Polynomial;
import com.raditha.mwp.algebra.Scalar;
import com.raditha.mwp.bound.Bound;
import com.raditha.mwp.choice.Choices;
import com.raditha.mwp.model.AnalysisReport;
import com.raditha.mwp.model.FunctionResult;
import com.raditha.mwp.relation.Matrix;
import com.raditha.mwp.relation.Relation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts analysis results to and from their JSON records.
 * DTO records keep the persisted shape independent of the domain classes.
 */
public class ResultCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public record MonomialDTO(String scalar, List<List<Integer>> deltas) {}

    public record RelationDTO(List<String> variables, List<List<List<MonomialDTO>>> matrix) {}

    public record FunctionDTO(
            String name,
            List<String> variables,
            int index,
            RelationDTO relation,
            List<List<Integer>> choices,
            boolean infinity,
            Map<String, String> bound,
            Map<String, List<String>> flows,
            long durationMillis) {}

    public record ProgramDTO(String path, int lines) {}

    public record ReportDTO(
            ProgramDTO program,
            Instant start,
            Instant end,
            List<FunctionDTO> functions,
            List<String> skipped) {}

    private ResultCodec() {
    }

    public static String toJson(AnalysisReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(encode(report));
    }

    /**
     * Parse a report.
     *
     * @throws JsonProcessingException  if the text is not a report record
     * @throws IllegalArgumentException if the record holds an invalid relation
     */
    public static AnalysisReport fromJson(String json) throws JsonProcessingException {
        return decode(mapper.readValue(json, ReportDTO.class));
    }

    public static String functionToJson(FunctionResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(encode(result));
    }

    public static FunctionResult functionFromJson(String json) throws JsonProcessingException {
        return decode(mapper.readValue(json, FunctionDTO.class));
    }

    public static ReportDTO encode(AnalysisReport report) {
        return new ReportDTO(
                new ProgramDTO(report.program(), report.lines()),
                report.start(),
                report.end(),
                report.functions().stream().map(ResultCodec::encode).toList(),
                report.skipped());
    }

    public static AnalysisReport decode(ReportDTO dto) {
        ProgramDTO program = dto.program() != null ? dto.program() : new ProgramDTO(null, 0);
        List<FunctionResult> functions = dto.functions() == null ? List.of()
                : dto.functions().stream().map(ResultCodec::decode).toList();
        return new AnalysisReport(program.path(), program.lines(), dto.start(), dto.end(), functions, dto.skipped());
    }

    public static FunctionDTO encode(FunctionResult result) {
        return new FunctionDTO(
                result.name(),
                result.variables(),
                result.index(),
                encode(result.relation()),
                result.choices() != null ? result.choices().allowed() : null,
                result.infinite(),
                result.bound() != null ? result.bound().toTriples() : null,
                result.flows().isEmpty() ? null : result.flows(),
                result.durationMillis());
    }

    public static FunctionResult decode(FunctionDTO dto) {
        if (dto.name() == null) {
            throw new IllegalArgumentException("Function record has no name");
        }
        Relation relation = dto.relation() != null ? decode(dto.relation()) : Relation.empty();
        Choices choices = null;
        if (dto.choices() != null) {
            choices = new Choices(Choices.DEFAULT_DOMAIN, dto.choices().size(), dto.choices(), dto.infinity());
        }
        Bound bound = dto.bound() != null ? Bound.fromTriples(dto.bound()) : null;
        return new FunctionResult(dto.name(), dto.variables(), relation, dto.index(), choices, dto.infinity(),
                bound, dto.flows(), dto.durationMillis());
    }

    public static RelationDTO encode(Relation relation) {
        List<List<List<MonomialDTO>>> matrix = new ArrayList<>();
        for (List<Polynomial> row : relation.matrix().rows()) {
            List<List<MonomialDTO>> encodedRow = new ArrayList<>(row.size());
            for (Polynomial cell : row) {
                encodedRow.add(cell.monomials().stream().map(ResultCodec::encode).toList());
            }
            matrix.add(encodedRow);
        }
        return new RelationDTO(relation.variables(), matrix);
    }

    /**
     * Rebuild a relation.
     *
     * @throws IllegalArgumentException for unknown scalars, malformed deltas or a ragged matrix
     */
    public static Relation decode(RelationDTO dto) {
        List<String> variables = dto.variables() == null ? List.of() : dto.variables();
        List<List<Polynomial>> rows = new ArrayList<>();
        if (dto.matrix() != null) {
            for (List<List<MonomialDTO>> row : dto.matrix()) {
                List<Polynomial> decodedRow = new ArrayList<>(row.size());
                for (List<MonomialDTO> cell : row) {
                    decodedRow.add(Polynomial.of(cell.stream().map(ResultCodec::decode).toList()));
                }
                rows.add(decodedRow);
            }
        }
        return new Relation(variables, Matrix.of(rows));
    }

    private static MonomialDTO encode(Monomial monomial) {
        List<List<Integer>> deltas = monomial.deltas().stream()
                .map(d -> List.of(d.value(), d.index()))
                .toList();
        return new MonomialDTO(monomial.scalar().symbol(), deltas);
    }

    private static Monomial decode(MonomialDTO dto) {
        List<Delta> deltas = new ArrayList<>();
        if (dto.deltas() != null) {
            for (List<Integer> pair : dto.deltas()) {
                if (pair == null || pair.size() != 2) {
                    throw new IllegalArgumentException("Delta must be a [value, index] pair: " + pair);
                }
                deltas.add(new Delta(pair.get(0), pair.get(1)));
            }
        }
        return new Monomial(Scalar.fromSymbol(dto.scalar()), deltas);
    }
}
