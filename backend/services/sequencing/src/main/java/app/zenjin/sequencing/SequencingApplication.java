package app.zenjin.sequencing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class SequencingApplication {

	public static void main(String[] args) {
		SpringApplication.run(SequencingApplication.class, args);
	}

}
