package com.helix.guardrails.configuration;

import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared store clients. Built once at context start and injected wherever needed.
 */
@Slf4j
@Configuration
public class StoreConfiguration {

    @Bean
    public Pinecone pineconeClient(AppProperties props) {
        return new Pinecone.Builder(props.getPinecone().getApiKey()).build();
    }

    @Bean
    public Index pineconeIndex(Pinecone pineconeClient, AppProperties props) {
        String indexName = props.getPinecone().getIndexName();
        log.info("Connecting to Pinecone index '{}'", indexName);
        return pineconeClient.getIndexConnection(indexName);
    }

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(AppProperties props) {
        Neo4jProperties neo4j = props.getNeo4j();
        log.info("Connecting to Neo4j at {}", neo4j.getUri());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
    }
}
