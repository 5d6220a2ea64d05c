package io.github.yok.dispersion.out;

import io.github.yok.dispersion.core.spectrum.Spectrum;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 評価結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は出力名）。
 * </p>
 *
 * <ul>
 * <li>{@code dispersion_dielectric_name.csv}（Wavelength, ϵ1, ϵ2）</li>
 * <li>{@code dispersion_refractiveIndex_name.csv}（Wavelength, n, k）</li>
 * <li>{@code dispersion_meta_name.csv}（符号規約、点数、波長範囲）</li>
 * </ul>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "dispersion";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が null または空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 誘電率と屈折率のスペクトルを CSV に出力します。
     *
     * @param name 出力名です
     * @param dielectric 誘電率のスペクトルです
     * @param refractiveIndex 屈折率のスペクトルです
     * @param conjugate ε1-iε2（n-ik）規約かどうかです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String name, Spectrum dielectric, Spectrum refractiveIndex,
            boolean conjugate) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name は必須です");
        }
        if (dielectric == null) {
            throw new IllegalArgumentException("dielectric は null 不可です");
        }
        if (refractiveIndex == null) {
            throw new IllegalArgumentException("refractiveIndex は null 不可です");
        }
        if (dielectric.size() != refractiveIndex.size()) {
            throw new IllegalArgumentException("dielectric と refractiveIndex の行数が一致しません: "
                    + dielectric.size() + " != " + refractiveIndex.size());
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 誘電率
            writeSpectrumCsv(buildFileName("dielectric", name), dielectric, "ϵ1", "ϵ2");

            // 2) 屈折率
            writeSpectrumCsv(buildFileName("refractiveIndex", name), refractiveIndex, "n", "k");

            // 3) メタ
            writeMetaCsv(buildFileName("meta", name), dielectric, conjugate);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }

        log.info("CSV を出力しました。出力先={}、name={}、行数={}", outputDir, name, dielectric.size());
    }

    /**
     * スペクトルを 1 ファイルに出力します。
     *
     * @param fileName ファイル名です
     * @param spectrum スペクトルです
     * @param realHeader 実部の列名です
     * @param imaginaryHeader 虚部の列名です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSpectrumCsv(String fileName, Spectrum spectrum, String realHeader,
            String imaginaryHeader) throws IOException {

        Path file = outputDir.resolve(fileName);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("Wavelength", realHeader, imaginaryHeader).build().print(w)) {

            for (int row = 0; row < spectrum.size(); row++) {
                pr.printRecord(spectrum.wavelengthAt(row), spectrum.valueAt(row).getReal(),
                        spectrum.valueAt(row).getImaginary());
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param fileName ファイル名です
     * @param dielectric 誘電率のスペクトルです
     * @param conjugate ε1-iε2（n-ik）規約かどうかです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(String fileName, Spectrum dielectric, boolean conjugate)
            throws IOException {

        Path file = outputDir.resolve(fileName);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("convention", conjugate ? "eps1-i*eps2" : "eps1+i*eps2");
            pr.printRecord("points", dielectric.size());
            if (dielectric.size() > 0) {
                pr.printRecord("wavelength.start", dielectric.wavelengthAt(0));
                pr.printRecord("wavelength.end", dielectric.wavelengthAt(dielectric.size() - 1));
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code dispersion_dielectric_TiO2.csv}
     * </p>
     *
     * @param kind 量の識別子（dielectric/refractiveIndex/meta）
     * @param name 出力名です
     * @return ファイル名です
     */
    private static String buildFileName(String kind, String name) {
        return FILE_HEAD + "_" + kind + "_" + name + ".csv";
    }
}
