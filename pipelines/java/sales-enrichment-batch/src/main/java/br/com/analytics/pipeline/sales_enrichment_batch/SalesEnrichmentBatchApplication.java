package br.com.analytics.pipeline.sales_enrichment_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesEnrichmentBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SalesEnrichmentBatchApplication.class, args)));
    }

}
