package io.github.yok.dispersion.app;

import io.github.yok.dispersion.core.law.DispersionLaw;
import io.github.yok.dispersion.out.CsvResultWriter;
import io.github.yok.dispersion.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 分散則の組み立てと結果出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class DispersionConfiguration {

    /**
     * dispersion-law の設定値（dispersion.*）です。
     */
    private final DispersionProperties p;

    /**
     * モデル定義から分散則を組み立てるファクトリを生成します。
     *
     * @return ファクトリです
     */
    @Bean
    public DispersionLawFactory dispersionLawFactory() {
        return new DispersionLawFactory();
    }

    /**
     * dispersion.models の全定義を足し合わせた分散則を生成します。
     *
     * @param factory ファクトリです
     * @return 分散則です
     */
    @Bean
    public DispersionLaw dispersionLaw(DispersionLawFactory factory) {
        return factory.create(p.getModels());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
