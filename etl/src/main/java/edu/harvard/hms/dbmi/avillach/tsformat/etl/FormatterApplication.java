package edu.harvard.hms.dbmi.avillach.tsformat.etl;

import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.DatasetDescriptorLoader;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.DatasetWriter;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries.TimeSeriesFormatter;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

/**
 * Formats the time series of a dataset into a long form dataset.
 *
 * Run with:
 * java -jar etl.jar \
 *   --formatter.dataset-doc=/path/to/dataset/datasetDoc.json \
 *   --formatter.output-dir=/path/to/output \
 *   [--formatter.main-resource-index=learningData] [--formatter.file-col-index=1] [--formatter.read-threads=4]
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FormatterApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormatterApplication.class, args);
    }

    @Bean
    DatasetDescriptorLoader datasetDescriptorLoader() {
        return new DatasetDescriptorLoader();
    }

    @Bean
    TimeSeriesFormatter timeSeriesFormatter() {
        return new TimeSeriesFormatter();
    }

    @Bean
    DatasetWriter datasetWriter() {
        return new DatasetWriter();
    }

    @Bean
    ApplicationRunner runFormatter(FormatterService formatterService) {
        return args -> formatterService.run();
    }
}
