package com.williamcallahan.pdfrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PdfRagApplication {

    public static void main(String[] args) {
        // Disable Netty native OpenSSL (tcnative) inside the shaded gRPC transport
        System.setProperty("io.grpc.netty.shaded.io.netty.handler.ssl.noOpenSsl", "true");
        SpringApplication.run(PdfRagApplication.class, args);
    }

}
