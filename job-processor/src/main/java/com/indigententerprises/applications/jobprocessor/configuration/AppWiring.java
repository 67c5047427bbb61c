package com.indigententerprises.applications.jobprocessor.configuration;

import com.indigententerprises.applications.pipeline.domain.ServiceIdentity;
import com.indigententerprises.applications.pipeline.infrastructure.ContractDocumentLoader;
import com.indigententerprises.applications.pipeline.infrastructure.JobEventsConsumer;
import com.indigententerprises.applications.pipeline.infrastructure.ProcessorMetrics;
import com.indigententerprises.applications.pipeline.infrastructure.VersionDescriptor;
import com.indigententerprises.applications.pipeline.repositories.JobRepository;
import com.indigententerprises.applications.pipeline.serviceimplementations.CompletionPublisher;
import com.indigententerprises.applications.pipeline.serviceimplementations.ContractRegistry;
import com.indigententerprises.applications.pipeline.serviceimplementations.ContractValidator;
import com.indigententerprises.applications.pipeline.serviceimplementations.DeadLetterRouter;
import com.indigententerprises.applications.pipeline.serviceimplementations.JobPipelineOrchestrator;
import com.indigententerprises.applications.pipeline.serviceimplementations.SimulatedJobWork;
import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;
import com.indigententerprises.applications.pipeline.serviceinterfaces.JobStore;
import com.indigententerprises.applications.pipeline.serviceinterfaces.JobWork;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppWiring implements ApplicationContextAware {

    @Value("${job.processor.bootstrap.servers}")
    private String bootstrapServers;

    @Value("${job.processor.group.id}")
    private String groupId;

    @Value("${job.processor.jobs.created.topic}")
    private String jobsCreatedTopic;

    @Value("${job.processor.jobs.completed.topic}")
    private String jobsCompletedTopic;

    @Value("${job.processor.dead.letter.topic}")
    private String deadLetterTopic;

    @Value("${job.processor.contracts.path}")
    private String contractsPath;

    @Value("${job.processor.service.name}")
    private String serviceName;

    @Value("${job.processor.version.resource:VERSION}")
    private String versionResource;

    @Value("${job.processor.request.timeout.ms.config}")
    private long requestTimeoutMs;

    @Value("${job.processor.delivery.timeout.ms.config}")
    private long deliveryTimeoutMs;

    @Value("${job.processor.work.duration.ms:2000}")
    private long workDurationMs;

    @Value("${job.processor.retry.initial.backoff.ms:1000}")
    private long initialBackOffMs;

    @Value("${job.processor.retry.max.backoff.ms:60000}")
    private long maxBackOffMs;

    private ApplicationContext applicationContext;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod="shutdown")
    public ExecutorService consumerExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public ServiceIdentity serviceIdentity() throws ConfigurationException {
        final String version = VersionDescriptor.read(AppWiring.class.getClassLoader(), versionResource);
        return new ServiceIdentity(serviceName, version);
    }

    @Bean
    public KafkaProducer<String, String> producer() {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, String.valueOf(deliveryTimeoutMs));

        final KafkaProducer<String, String> result = new KafkaProducer<>(props);
        return result;
    }

    // closed by the consumer loop itself, on the thread that owns it
    @Bean(destroyMethod="")
    public KafkaConsumer<String, String> consumer() {
        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");

        final KafkaConsumer<String, String> result = new KafkaConsumer<>(props);
        return result;
    }

    @Bean
    public ContractValidator contractValidator(final ObjectMapper objectMapper) throws ConfigurationException {
        final ContractDocumentLoader loader = new ContractDocumentLoader(objectMapper);
        final ContractRegistry registry = new ContractRegistry(
                loader.load(
                        Paths.get(contractsPath),
                        List.of(ContractValidator.ENVELOPE_CONTRACT, ContractValidator.JOB_CONTRACT)
                )
        );
        final ContractValidator contractValidator = new ContractValidator(registry);
        return contractValidator;
    }

    @Bean
    public ProcessorMetrics processorMetrics(final MeterRegistry meterRegistry) {
        return new ProcessorMetrics(meterRegistry);
    }

    @Bean
    public JobStore jobStore(final ObjectMapper objectMapper, final JobRepository jobRepository) {
        final JobStore jobStore =
                new com.indigententerprises.applications.pipeline.serviceimplementations.JobPersistenceService(
                        objectMapper,
                        jobRepository
                );
        return jobStore;
    }

    @Bean
    public JobWork jobWork() {
        return new SimulatedJobWork(Duration.ofMillis(workDurationMs));
    }

    @Bean
    public CompletionPublisher completionPublisher(
            final ObjectMapper objectMapper,
            final KafkaProducer<String, String> producer
    ) {
        final CompletionPublisher completionPublisher =
                new CompletionPublisher(objectMapper, producer, jobsCompletedTopic, requestTimeoutMs);
        return completionPublisher;
    }

    @Bean
    public DeadLetterRouter deadLetterRouter(
            final ObjectMapper objectMapper,
            final KafkaProducer<String, String> producer,
            final ServiceIdentity serviceIdentity,
            final Clock clock
    ) {
        final DeadLetterRouter deadLetterRouter = new DeadLetterRouter(
                objectMapper,
                producer,
                deadLetterTopic,
                serviceIdentity,
                clock,
                requestTimeoutMs
        );
        return deadLetterRouter;
    }

    @Bean
    public JobPipelineOrchestrator jobPipelineOrchestrator(
            final ObjectMapper objectMapper,
            final ContractValidator contractValidator,
            final JobStore jobStore,
            final JobWork jobWork,
            final CompletionPublisher completionPublisher,
            final DeadLetterRouter deadLetterRouter,
            final ProcessorMetrics processorMetrics,
            final ServiceIdentity serviceIdentity,
            final Clock clock
    ) {
        return new JobPipelineOrchestrator(
                objectMapper,
                contractValidator,
                jobStore,
                jobWork,
                completionPublisher,
                deadLetterRouter,
                processorMetrics,
                serviceIdentity,
                clock
        );
    }

    @Bean(destroyMethod="shutdown")
    public JobEventsConsumer jobEventsConsumer(
            final KafkaConsumer<String, String> consumer,
            final JobPipelineOrchestrator jobPipelineOrchestrator
    ) {
        final JobEventsConsumer jobEventsConsumer = new JobEventsConsumer(
                consumer,
                jobPipelineOrchestrator,
                jobsCreatedTopic,
                initialBackOffMs,
                maxBackOffMs
        );
        jobEventsConsumer.setApplicationContext(applicationContext);
        return jobEventsConsumer;
    }

    @Bean
    public ApplicationRunner runner(
            final JobEventsConsumer jobEventsConsumer,
            final ExecutorService consumerExecutor
    ) {
        return args -> {
            consumerExecutor.submit(jobEventsConsumer);
        };
    }
}
