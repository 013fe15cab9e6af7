package com.example.affairsdigest.service.render;

import com.example.affairsdigest.exception.FetchException;

public interface ImageFetcher {
    byte[] fetch(String url) throws FetchException;
}
