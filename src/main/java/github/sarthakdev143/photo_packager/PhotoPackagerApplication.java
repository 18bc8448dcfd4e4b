package github.sarthakdev143.photo_packager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PhotoPackagerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PhotoPackagerApplication.class, args);
	}

}
